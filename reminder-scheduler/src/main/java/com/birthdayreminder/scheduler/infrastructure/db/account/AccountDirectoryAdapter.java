package com.birthdayreminder.scheduler.infrastructure.db.account;

import com.birthdayreminder.scheduler.domain.account.AccountDirectory;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class AccountDirectoryAdapter implements AccountDirectory {

    private final AccountJpaRepository jpaRepository;

    @Override
    @Transactional(readOnly = true)
    public List<String> findAllAccountIds() {
        return jpaRepository.findAllIds();
    }
}
