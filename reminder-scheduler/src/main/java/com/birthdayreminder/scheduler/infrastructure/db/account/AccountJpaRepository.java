package com.birthdayreminder.scheduler.infrastructure.db.account;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface AccountJpaRepository extends JpaRepository<AccountEntity, String> {

    @Query("SELECT a.id FROM AccountEntity a ORDER BY a.id")
    List<String> findAllIds();
}
