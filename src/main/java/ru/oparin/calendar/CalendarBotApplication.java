package ru.oparin.calendar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CalendarBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalendarBotApplication.class, args);
    }
}
