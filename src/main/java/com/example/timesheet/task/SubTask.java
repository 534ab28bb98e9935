package com.example.timesheet.task;

import com.example.timesheet.time.Hours;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Client-attributed slice of a day's work.
 */
@Embeddable
public class SubTask {

    @Column(name = "client_id")
    private Long clientId;

    @Column(length = 500)
    private String description;

    @Column(nullable = false, precision = 4, scale = 2)
    private BigDecimal hours;

    protected SubTask() {
    }

    public SubTask(Long clientId, String description, BigDecimal hours) {
        this.clientId = clientId;
        this.description = description;
        this.hours = Hours.requireBookable(hours);
    }

    public static SubTask of(Long clientId, String description, String hours) {
        return new SubTask(clientId, description, new BigDecimal(hours));
    }

    public Long getClientId() { return clientId; }
    public String getDescription() { return description; }
    public BigDecimal getHours() { return hours; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubTask)) return false;
        SubTask other = (SubTask) o;
        return Objects.equals(clientId, other.clientId)
                && Objects.equals(description, other.description)
                && hours.compareTo(other.hours) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(clientId, description, hours.stripTrailingZeros());
    }
}
