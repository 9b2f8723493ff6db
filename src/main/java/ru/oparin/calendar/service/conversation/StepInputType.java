package ru.oparin.calendar.service.conversation;

/**
 * Ожидаемый тип ввода на шаге диалога.
 */
public enum StepInputType {

    /**
     * Непустой текст
     */
    TEXT,

    /**
     * Дата в формате yyyy-MM-dd
     */
    DATE,

    /**
     * Время в формате HH:mm (24 часа)
     */
    TIME,

    /**
     * Положительное целое число (ID)
     */
    POSITIVE_ID,

    /**
     * Текст или маркер пропуска
     */
    OPTIONAL_TEXT,

    /**
     * Да/нет для публичности события
     */
    VISIBILITY
}
