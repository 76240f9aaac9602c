package com.birthdayreminder.scheduler.infrastructure.db.birthday;

import com.birthdayreminder.scheduler.domain.birthday.Birthday;
import com.birthdayreminder.scheduler.domain.birthday.BirthdayRepository;
import com.birthdayreminder.scheduler.infrastructure.db.birthday.mapper.BirthdayEntityMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class BirthdayRepositoryAdapter implements BirthdayRepository {

    private final BirthdayJpaRepository jpaRepository;
    private final BirthdayEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<Birthday> findByUserId(String userId) {
        return jpaRepository.findByUserIdOrderByIdAsc(userId).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
