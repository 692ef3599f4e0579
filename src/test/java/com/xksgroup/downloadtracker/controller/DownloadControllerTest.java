package com.xksgroup.downloadtracker.controller;

import com.xksgroup.downloadtracker.exception.PriorityChangeRejectedException;
import com.xksgroup.downloadtracker.exception.PriorityChangeRejectedException.Reason;
import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.download.MediaMatch;
import com.xksgroup.downloadtracker.model.download.Priority;
import com.xksgroup.downloadtracker.model.dto.StatsDto;
import com.xksgroup.downloadtracker.service.DownloadQueryService;
import com.xksgroup.downloadtracker.service.PriorityService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({DownloadController.class, StatsController.class})
@DisplayName("DownloadController Tests")
class DownloadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DownloadQueryService downloadQueryService;

    @MockBean
    private PriorityService priorityService;

    @Test
    @DisplayName("Should list every download with its media match flattened")
    void testListDownloads() throws Exception {
        when(downloadQueryService.listAll()).thenReturn(List.of(downloading()));

        mockMvc.perform(get("/tracker/api/v1/downloads"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("dl-1"))
                .andExpect(jsonPath("$[0].status").value("downloading"))
                .andExpect(jsonPath("$[0].priority").value("Normal"))
                .andExpect(jsonPath("$[0].mediaTitle").value("Show Name"))
                .andExpect(jsonPath("$[0].mediaType").value("tv"))
                .andExpect(jsonPath("$[0].episode").value(18))
                .andExpect(jsonPath("$[0].failed").value(false));
    }

    @Test
    @DisplayName("Should filter downloads by status")
    void testListDownloads_ByStatus() throws Exception {
        when(downloadQueryService.listByStatus(DownloadStatus.QUEUED)).thenReturn(List.of());

        mockMvc.perform(get("/tracker/api/v1/downloads").param("status", "queued"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(downloadQueryService).listByStatus(DownloadStatus.QUEUED);
        verify(downloadQueryService, never()).listAll();
    }

    @Test
    @DisplayName("Should reject an unknown status filter")
    void testListDownloads_UnknownStatus() throws Exception {
        mockMvc.perform(get("/tracker/api/v1/downloads").param("status", "paused"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("Should return the updated download after a priority change")
    void testUpdatePriority() throws Exception {
        DownloadRecord record = downloading();
        record.setStatus(DownloadStatus.QUEUED);
        record.setPriority(Priority.HIGH);
        when(priorityService.updatePriority("dl-1", "high")).thenReturn(record);

        mockMvc.perform(post("/tracker/api/v1/downloads/dl-1/priority")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\": \"high\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.priority").value("High"))
                .andExpect(jsonPath("$.status").value("queued"));
    }

    @Test
    @DisplayName("Should map rejection reasons to HTTP statuses")
    void testUpdatePriority_Rejected() throws Exception {
        when(priorityService.updatePriority(anyString(), anyString()))
                .thenThrow(new PriorityChangeRejectedException(Reason.NOT_FOUND, "dl-9", "Download not found: dl-9"))
                .thenThrow(new PriorityChangeRejectedException(Reason.INVALID_STATE, "dl-1", "not queued"))
                .thenThrow(new PriorityChangeRejectedException(Reason.INVALID_LABEL, "dl-1", "Unknown priority label"))
                .thenThrow(new PriorityChangeRejectedException(Reason.CONTROLLER_REJECTED, "dl-1", "refused"));

        String body = "{\"priority\": \"High\"}";
        mockMvc.perform(post("/tracker/api/v1/downloads/dl-9/priority").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details").value("Download not found: dl-9"));
        mockMvc.perform(post("/tracker/api/v1/downloads/dl-1/priority").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/tracker/api/v1/downloads/dl-1/priority").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/tracker/api/v1/downloads/dl-1/priority").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadGateway());
    }

    @Test
    @DisplayName("Should reject a request without a priority")
    void testUpdatePriority_Blank() throws Exception {
        mockMvc.perform(post("/tracker/api/v1/downloads/dl-1/priority")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\": \"\"}"))
                .andExpect(status().isBadRequest());

        verify(priorityService, never()).updatePriority(any(), any());
    }

    @Test
    @DisplayName("Should report how many poster flags were reset")
    void testResetPosterFlags() throws Exception {
        when(downloadQueryService.resetPosterFlags()).thenReturn(4L);

        mockMvc.perform(post("/tracker/api/v1/downloads/admin/reset-poster-flags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.reset").value(4));
    }

    @Test
    @DisplayName("Should expose download statistics")
    void testStats() throws Exception {
        when(downloadQueryService.stats()).thenReturn(StatsDto.builder()
                .downloading(2).queued(1).completed(5).failed(0).totalSpeed(3.58).build());

        mockMvc.perform(get("/tracker/api/v1/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.downloading").value(2))
                .andExpect(jsonPath("$.completed").value(5))
                .andExpect(jsonPath("$.totalSpeed").value(3.58));
    }

    private static DownloadRecord downloading() {
        return DownloadRecord.builder()
                .id("dl-1")
                .externalId("SABnzbd_nzo_1")
                .name("Show.Name.S06E18.1080p")
                .status(DownloadStatus.DOWNLOADING)
                .progress(42.5)
                .speed(12.3)
                .priority(Priority.NORMAL)
                .category("tv")
                .mediaMatch(MediaMatch.builder()
                        .mediaTitle("Show Name")
                        .mediaType(com.xksgroup.downloadtracker.model.download.MediaType.TV)
                        .season(6)
                        .episode(18)
                        .sourceInstance("sonarr-main")
                        .build())
                .build();
    }
}
