package com.birthdayreminder.scheduler.application.job;

public enum SchedulerState {
    STOPPED,
    WAITING,
    RUNNING
}
