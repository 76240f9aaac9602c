package com.birthdayreminder.scheduler.domain.birthday;

import java.util.List;

public interface BirthdayRepository {

    List<Birthday> findByUserId(String userId);
}
