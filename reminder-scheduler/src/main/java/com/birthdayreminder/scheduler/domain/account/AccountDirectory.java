package com.birthdayreminder.scheduler.domain.account;

import java.util.List;

/** Read-only view of the account directory owned by the user-management layer. */
public interface AccountDirectory {

    List<String> findAllAccountIds();
}
