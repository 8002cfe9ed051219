package com.scholary.pdf.handler.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.pdf.handler.processor.DocumentProcessorRegistry;
import com.scholary.pdf.handler.service.ProcessingStatsService;
import com.scholary.pdf.handler.worker.WorkerPool;
import com.scholary.pdf.handler.worker.WorkerPoolStatus;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ProcessingHistoryController.class)
class ProcessingHistoryControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private ProcessingStatsService statsService;
  @MockBean private DocumentProcessorRegistry registry;
  @MockBean private WorkerPool workerPool;

  @Test
  void recentJobs_shouldRejectNonNumericLimit() throws Exception {
    mockMvc
        .perform(get("/api/recent-jobs").param("limit", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.category").value("INVALID_REQUEST"));
  }

  @Test
  void recentJobs_shouldClampLimit() throws Exception {
    when(statsService.recentJobs(500)).thenReturn(List.of());

    mockMvc.perform(get("/api/recent-jobs").param("limit", "10000")).andExpect(status().isOk());

    verify(statsService).recentJobs(500);
  }

  @Test
  void workerStatus_shouldReturnPoolSnapshot() throws Exception {
    when(workerPool.status()).thenReturn(new WorkerPoolStatus(1, 1, 4, 1, 2, 1, 0));

    mockMvc
        .perform(get("/api/worker-status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.workers").value(1))
        .andExpect(jsonPath("$.timedOut").value(2))
        .andExpect(jsonPath("$.replaced").value(1));
  }
}
