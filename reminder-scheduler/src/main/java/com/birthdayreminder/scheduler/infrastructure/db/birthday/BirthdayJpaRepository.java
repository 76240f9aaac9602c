package com.birthdayreminder.scheduler.infrastructure.db.birthday;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BirthdayJpaRepository extends JpaRepository<BirthdayEntity, String> {

    List<BirthdayEntity> findByUserIdOrderByIdAsc(String userId);
}
