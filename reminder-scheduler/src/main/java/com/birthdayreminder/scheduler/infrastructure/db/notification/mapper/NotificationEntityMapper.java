package com.birthdayreminder.scheduler.infrastructure.db.notification.mapper;

import com.birthdayreminder.scheduler.domain.notification.Notification;
import com.birthdayreminder.scheduler.infrastructure.db.notification.NotificationEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface NotificationEntityMapper {

    NotificationEntity toEntity(Notification notification);

    Notification toDomain(NotificationEntity entity);
}
