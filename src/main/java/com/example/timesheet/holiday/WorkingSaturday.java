package com.example.timesheet.holiday;

import jakarta.persistence.*;
import java.time.LocalDate;

/**
 * A Saturday declared as a regular working day. At most one per calendar month.
 */
@Entity
@Table(name = "working_saturdays",
        uniqueConstraints = @UniqueConstraint(name = "uq_working_saturday_month", columnNames = {"work_year", "work_month"}))
public class WorkingSaturday {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "work_date", unique = true, nullable = false)
    private LocalDate date;

    @Column(name = "work_year", nullable = false)
    private int year;

    @Column(name = "work_month", nullable = false)
    private int month;

    @Column(length = 255)
    private String description;

    protected WorkingSaturday() {}

    public WorkingSaturday(LocalDate date, String description) {
        this.date = date;
        this.year = date.getYear();
        this.month = date.getMonthValue();
        this.description = description;
    }

    public Long getId() { return id; }
    public LocalDate getDate() { return date; }
    public int getYear() { return year; }
    public int getMonth() { return month; }
    public String getDescription() { return description; }
}
