package io.github.orbit.persistence.document;

import io.github.orbit.protocol.api.MonthlyType;
import io.github.orbit.protocol.api.ScheduleFrequency;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Document(collection = "scheduled_scans")
public class ScheduledScanDocument {

    @Id
    private String id;
    @Indexed
    private String scanId;
    private String cronExpression;
    private ScheduleDetails scheduleDetails;
    private Instant startDate;
    private Instant endDate;
    private Instant createdAt;

    public ScheduledScanDocument() {}

    /** A schedule whose end date has passed must never fire again. */
    public boolean isExpired(Instant now) {
        return endDate != null && endDate.isBefore(now);
    }

    public boolean hasExplicitCron() {
        return cronExpression != null && !cronExpression.isBlank();
    }

    // Embedded: ScheduleDetails
    public static class ScheduleDetails {
        private ScheduleFrequency frequency;
        private List<String> selectedDays;
        private MonthlyType monthlyType;
        private Integer monthlyDate;
        private String monthlyDay;
        private String monthlyWeek;

        public ScheduleDetails() {}

        public ScheduleFrequency getFrequency() { return frequency; }
        public void setFrequency(ScheduleFrequency frequency) { this.frequency = frequency; }
        public List<String> getSelectedDays() { return selectedDays; }
        public void setSelectedDays(List<String> selectedDays) { this.selectedDays = selectedDays; }
        public MonthlyType getMonthlyType() { return monthlyType; }
        public void setMonthlyType(MonthlyType monthlyType) { this.monthlyType = monthlyType; }
        public Integer getMonthlyDate() { return monthlyDate; }
        public void setMonthlyDate(Integer monthlyDate) { this.monthlyDate = monthlyDate; }
        public String getMonthlyDay() { return monthlyDay; }
        public void setMonthlyDay(String monthlyDay) { this.monthlyDay = monthlyDay; }
        public String getMonthlyWeek() { return monthlyWeek; }
        public void setMonthlyWeek(String monthlyWeek) { this.monthlyWeek = monthlyWeek; }

        @Override
        public String toString() {
            return "ScheduleDetails{frequency=" + frequency + ", selectedDays=" + selectedDays
                    + ", monthlyType=" + monthlyType + ", monthlyDate=" + monthlyDate
                    + ", monthlyDay=" + monthlyDay + ", monthlyWeek=" + monthlyWeek + "}";
        }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getScanId() { return scanId; }
    public void setScanId(String scanId) { this.scanId = scanId; }
    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
    public ScheduleDetails getScheduleDetails() { return scheduleDetails; }
    public void setScheduleDetails(ScheduleDetails scheduleDetails) { this.scheduleDetails = scheduleDetails; }
    public Instant getStartDate() { return startDate; }
    public void setStartDate(Instant startDate) { this.startDate = startDate; }
    public Instant getEndDate() { return endDate; }
    public void setEndDate(Instant endDate) { this.endDate = endDate; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
