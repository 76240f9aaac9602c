package com.birthdayreminder.scheduler.infrastructure.db.birthday.mapper;

import com.birthdayreminder.scheduler.domain.birthday.Birthday;
import com.birthdayreminder.scheduler.infrastructure.db.birthday.BirthdayEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface BirthdayEntityMapper {

    Birthday toDomain(BirthdayEntity entity);
}
