package com.trailvision.core.detection;

/**
 * Ошибка валидации входных детекций: нет timestamp, confidence вне [0,1],
 * неотсортированная группа и т.п. Фатальна для группы/прогона, наверх пробрасывается как есть.
 */
public class InvalidDetectionException extends RuntimeException {

    private final GroupKey group; // null, если ошибка не привязана к группе

    public InvalidDetectionException(String message) {
        this(null, message, null);
    }

    public InvalidDetectionException(GroupKey group, String message) {
        this(group, message, null);
    }

    public InvalidDetectionException(GroupKey group, String message, Throwable cause) {
        super(group == null ? message : "group " + group + ": " + message, cause);
        this.group = group;
    }

    public GroupKey group() {
        return group;
    }
}
