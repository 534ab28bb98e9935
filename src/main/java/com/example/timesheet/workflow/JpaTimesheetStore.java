package com.example.timesheet.workflow;

import com.example.timesheet.client.ClientRepository;
import com.example.timesheet.config.CacheConfig;
import com.example.timesheet.exception.ResourceNotFoundException;
import com.example.timesheet.holiday.WorkCalendarService;
import com.example.timesheet.leave.LeaveFilter;
import com.example.timesheet.leave.LeaveRequest;
import com.example.timesheet.leave.LeaveRequestRepository;
import com.example.timesheet.task.TaskEntry;
import com.example.timesheet.task.TaskEntryFilter;
import com.example.timesheet.task.TaskEntryRepository;
import com.example.timesheet.time.DateRange;
import com.example.timesheet.time.DayType;
import com.example.timesheet.user.UserAccountRepository;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;

@Repository
public class JpaTimesheetStore implements TimesheetStore {

    private final UserAccountRepository userAccountRepository;
    private final TaskEntryRepository taskEntryRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final ClientRepository clientRepository;
    private final WorkCalendarService workCalendarService;

    public JpaTimesheetStore(UserAccountRepository userAccountRepository,
                             TaskEntryRepository taskEntryRepository,
                             LeaveRequestRepository leaveRequestRepository,
                             ClientRepository clientRepository,
                             WorkCalendarService workCalendarService) {
        this.userAccountRepository = userAccountRepository;
        this.taskEntryRepository = taskEntryRepository;
        this.leaveRequestRepository = leaveRequestRepository;
        this.clientRepository = clientRepository;
        this.workCalendarService = workCalendarService;
    }

    @Override
    public void lockOwner(Long ownerId) {
        userAccountRepository.lockById(ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("User", ownerId));
    }

    @Override
    public TaskEntry lockTaskEntry(Long id) {
        return taskEntryRepository.lockById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Task entry", id));
    }

    @Override
    public LeaveRequest lockLeaveRequest(Long id) {
        return leaveRequestRepository.lockById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Leave request", id));
    }

    @Override
    public TaskEntry findTaskEntry(Long id) {
        return taskEntryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Task entry", id));
    }

    @Override
    public LeaveRequest findLeaveRequest(Long id) {
        return leaveRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Leave request", id));
    }

    @Override
    public List<TaskEntry> loadTaskEntriesForOwnerOnDate(Long ownerId, LocalDate date) {
        return taskEntryRepository.findByOwnerIdAndWorkDate(ownerId, date);
    }

    @Override
    public List<TaskEntry> loadTaskEntriesForOwnerBetween(Long ownerId, LocalDate from, LocalDate to) {
        return taskEntryRepository.findByOwnerIdAndWorkDateBetweenOrderByWorkDateAsc(ownerId, from, to);
    }

    @Override
    public List<LeaveRequest> loadLeaveForOwnerBetween(Long ownerId, DateRange range) {
        return leaveRequestRepository.findOverlapping(ownerId, range.start(), range.end());
    }

    @Override
    public List<TaskEntry> findTaskEntries(TaskEntryFilter filter, Pageable page) {
        return taskEntryRepository.findAll(filter.toSpecification(), page).getContent();
    }

    @Override
    public List<LeaveRequest> findLeaveRequests(LeaveFilter filter, Pageable page) {
        return leaveRequestRepository.findAll(filter.toSpecification(), page).getContent();
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.ACTIVE_CLIENTS, key = "'all'")
    public Set<Long> activeClientIds() {
        return Set.copyOf(clientRepository.findActiveIds());
    }

    @Override
    public DayType classify(LocalDate date) {
        return workCalendarService.forMonth(YearMonth.from(date)).classify(date);
    }

    @Override
    public TaskEntry save(TaskEntry entry) {
        return taskEntryRepository.save(entry);
    }

    @Override
    public LeaveRequest save(LeaveRequest leaveRequest) {
        return leaveRequestRepository.save(leaveRequest);
    }

    @Override
    public void delete(TaskEntry entry) {
        taskEntryRepository.delete(entry);
    }

    @Override
    public void delete(LeaveRequest leaveRequest) {
        leaveRequestRepository.delete(leaveRequest);
    }
}
