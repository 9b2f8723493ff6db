package ru.oparin.calendar.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Пара экспортных ссылок, выданных пользователю.
 */
@Data
@AllArgsConstructor
public class ExportLinksDTO {

    private String jsonUrl;

    private String csvUrl;
}
