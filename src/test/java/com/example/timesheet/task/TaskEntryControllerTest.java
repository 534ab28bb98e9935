package com.example.timesheet.task;

import com.example.timesheet.client.Client;
import com.example.timesheet.client.ClientRepository;
import com.example.timesheet.user.Role;
import com.example.timesheet.user.UserAccount;
import com.example.timesheet.user.UserAccountRepository;
import com.example.timesheet.user.UserDirectory;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class TaskEntryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Autowired
    private ClientRepository clientRepository;

    @Autowired
    private TaskEntryRepository taskEntryRepository;

    private Long employeeId;
    private Long clientId;

    @BeforeEach
    void setUp() {
        taskEntryRepository.deleteAll();
        employeeId = userAccountRepository.save(new UserAccount("Employee", "api-employee@example.com", Role.EMPLOYEE)).getId();
        clientId = clientRepository.save(new Client("Globex")).getId();
    }

    @Test
    void createTaskEntry_returnsDraft() throws Exception {
        String payload = """
            {
              "workDate": "2026-02-10",
              "taskName": "integration",
              "subTasks": [
                {"clientId": %d, "description": "api", "hours": 3},
                {"clientId": null, "description": "internal", "hours": 1.5}
              ]
            }
            """.formatted(clientId);

        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.status").value("DRAFT"))
            .andExpect(jsonPath("$.data.workDate").value("2026-02-10"))
            .andExpect(jsonPath("$.data.totalHours").value(4.5))
            .andExpect(jsonPath("$.data.subTasks.length()").value(2))
            .andExpect(jsonPath("$.data.overtime").value(false));

        List<TaskEntry> stored = taskEntryRepository.findByOwnerIdAndWorkDate(employeeId, LocalDate.of(2026, 2, 10));
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getCreatedBy()).isEqualTo(employeeId);
    }

    @Test
    void createTaskEntry_overDailyLimit_isConflictWithViolationDetails() throws Exception {
        createEntry(7);

        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("2026-02-10", 2)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("cannot log 9.00 hours on 2026-02-10: daily limit is 8.00"))
            .andExpect(jsonPath("$.meta.errorCode").value("DAILY_HOURS_EXCEEDED"))
            .andExpect(jsonPath("$.meta.violations[0].code").value("DAILY_HOURS_EXCEEDED"));
    }

    @Test
    void createTaskEntry_negativeHours_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("2026-02-10", -1)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta.errorCode").value("INVALID_HOURS"));
    }

    @Test
    void createTaskEntry_withoutUserHeader_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/task-entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("2026-02-10", 1)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void createTaskEntry_withoutWorkDate_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"taskName\": \"undated\", \"subTasks\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid request"))
            .andExpect(jsonPath("$.meta.workDate").value("workDate is required"));
    }

    @Test
    void createTaskEntry_descriptionOver500Characters_isBadRequest() throws Exception {
        String payload = """
            {
              "workDate": "2026-02-10",
              "subTasks": [{"clientId": %d, "description": "%s", "hours": 1}]
            }
            """.formatted(clientId, "d".repeat(600));

        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta['subTasks[0].description']").value("description must be at most 500 characters"));
        assertThat(taskEntryRepository.count()).isZero();
    }

    @Test
    void createTaskEntry_taskNameOver255Characters_isBadRequest() throws Exception {
        String payload = """
            {"workDate": "2026-02-10", "taskName": "%s", "subTasks": []}
            """.formatted("t".repeat(300));

        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta.taskName").value("taskName must be at most 255 characters"));
    }

    @Test
    void createTaskEntry_nullSubTask_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workDate\": \"2026-02-10\", \"subTasks\": [null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void createTaskEntry_subTaskWithoutHours_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workDate\": \"2026-02-10\", \"subTasks\": [{\"description\": \"no hours\"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta['subTasks[0].hours']").value("hours is required"));
    }

    @Test
    void updateTaskEntry_taskNameOver255Characters_isBadRequest() throws Exception {
        Long id = createEntry(2);

        mockMvc.perform(put("/api/task-entries/" + id)
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"taskName\": \"" + "t".repeat(256) + "\", \"subTasks\": []}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void updateSubmitDelete_followTheLifecycle() throws Exception {
        Long id = createEntry(2);

        mockMvc.perform(put("/api/task-entries/" + id)
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("2026-02-10", 5)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalHours").value(5.0));

        mockMvc.perform(post("/api/task-entries/" + id + "/submit")
                .header(UserDirectory.USER_ID_HEADER, employeeId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("SUBMITTED"));

        mockMvc.perform(delete("/api/task-entries/" + id)
                .header(UserDirectory.USER_ID_HEADER, employeeId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.meta.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    void submitSomeoneElsesEntry_isForbidden() throws Exception {
        Long id = createEntry(2);
        Long otherId = userAccountRepository.save(new UserAccount("Other", "other@example.com", Role.EMPLOYEE)).getId();

        mockMvc.perform(post("/api/task-entries/" + id + "/submit")
                .header(UserDirectory.USER_ID_HEADER, otherId))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.meta.errorCode").value("FORBIDDEN"));
    }

    @Test
    void unknownEntry_isNotFound() throws Exception {
        mockMvc.perform(post("/api/task-entries/999999/submit")
                .header(UserDirectory.USER_ID_HEADER, employeeId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.meta.errorCode").value("NOT_FOUND"));
    }

    @Test
    void getEntry_visibleToOwnerOnly() throws Exception {
        Long id = createEntry(2);
        Long otherId = userAccountRepository.save(new UserAccount("Other", "peek@example.com", Role.EMPLOYEE)).getId();

        mockMvc.perform(get("/api/task-entries/" + id)
                .header(UserDirectory.USER_ID_HEADER, employeeId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value(id))
            .andExpect(jsonPath("$.data.totalHours").value(2.0));

        mockMvc.perform(get("/api/task-entries/" + id)
                .header(UserDirectory.USER_ID_HEADER, otherId))
            .andExpect(status().isNotFound());
    }

    @Test
    void recheck_requiresTheUserHeader() throws Exception {
        Long id = createEntry(2);

        mockMvc.perform(get("/api/task-entries/" + id + "/recheck"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/task-entries/" + id + "/recheck")
                .header(UserDirectory.USER_ID_HEADER, employeeId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    void list_filtersByStatusAndClient() throws Exception {
        Long submitted = createEntry("2026-02-10", 2);
        createEntry("2026-02-11", 3);
        Long otherClient = clientRepository.save(new Client("Umbrella")).getId();
        mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"workDate": "2026-02-12", "subTasks": [{"clientId": %d, "hours": 1}]}
                    """.formatted(otherClient)))
            .andExpect(status().isCreated());
        mockMvc.perform(post("/api/task-entries/" + submitted + "/submit")
                .header(UserDirectory.USER_ID_HEADER, employeeId))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .param("status", "SUBMITTED"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].id").value(submitted));

        mockMvc.perform(get("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .param("clientId", otherClient.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].workDate").value("2026-02-12"));
    }

    @Test
    void list_pagesNewestWorkDateFirst() throws Exception {
        createEntry("2026-02-09", 1);
        createEntry("2026-02-10", 1);
        createEntry("2026-02-11", 1);

        mockMvc.perform(get("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .param("page", "0")
                .param("size", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(2))
            .andExpect(jsonPath("$.data[0].workDate").value("2026-02-11"))
            .andExpect(jsonPath("$.data[1].workDate").value("2026-02-10"));

        mockMvc.perform(get("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .param("page", "1")
                .param("size", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].workDate").value("2026-02-09"));
    }

    @Test
    void list_invertedRange_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .param("from", "2026-02-28")
                .param("to", "2026-02-01"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta.errorCode").value("INVALID_RANGE"));
    }

    @Test
    void list_returnsOwnEntriesInRange() throws Exception {
        createEntry(2);

        mockMvc.perform(get("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .param("from", "2026-02-01")
                .param("to", "2026-02-28"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].ownerId").value(employeeId));
    }

    private Long createEntry(int hours) throws Exception {
        return createEntry("2026-02-10", hours);
    }

    private Long createEntry(String date, int hours) throws Exception {
        String response = mockMvc.perform(post("/api/task-entries")
                .header(UserDirectory.USER_ID_HEADER, employeeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(date, hours)))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        Number id = JsonPath.read(response, "$.data.id");
        return id.longValue();
    }

    private String body(String date, int hours) {
        return """
            {
              "workDate": "%s",
              "taskName": "work",
              "subTasks": [{"clientId": %d, "description": "work", "hours": %d}]
            }
            """.formatted(date, clientId, hours);
    }
}
