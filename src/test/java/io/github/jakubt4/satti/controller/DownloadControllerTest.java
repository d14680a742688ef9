package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.dto.ClearImagesResponse;
import io.github.jakubt4.satti.dto.SaveLocalResponse;
import io.github.jakubt4.satti.exception.CommandConflictException;
import io.github.jakubt4.satti.service.UplinkService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DownloadController.class)
class DownloadControllerTest {

    private static final String API_KEY = "change-me";
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UplinkService uplinkService;

    @Test
    void downloadServesPngWithHeaderKey() throws Exception {
        when(uplinkService.download("cmd-1")).thenReturn(PNG);

        mockMvc.perform(get("/downloads/cmd-1").header("x-api-key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(PNG));
    }

    @Test
    void downloadAcceptsQueryParameterKey() throws Exception {
        when(uplinkService.download("cmd-1")).thenReturn(PNG);

        mockMvc.perform(get("/downloads/cmd-1").param("api_key", API_KEY))
                .andExpect(status().isOk());
    }

    @Test
    void queryParameterKeyIsIgnoredOutsideDownloads() throws Exception {
        mockMvc.perform(post("/images/clear").param("api_key", API_KEY))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void downloadOfUnfinishedCommandIsConflict() throws Exception {
        when(uplinkService.download("cmd-2")).thenThrow(new CommandConflictException("Image is not ready"));

        mockMvc.perform(get("/downloads/cmd-2").header("x-api-key", API_KEY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Image is not ready"));
    }

    @Test
    void saveLocalReportsPath() throws Exception {
        when(uplinkService.saveLocal("cmd-3")).thenReturn(
                new SaveLocalResponse("cmd-3", "/srv/satti/data/images/cmd-3.png", 2048L,
                        "Image is saved in local data/images directory"));

        mockMvc.perform(post("/downloads/cmd-3/save-local").header("x-api-key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileSizeBytes").value(2048));
    }

    @Test
    void clearImagesReportsCounts() throws Exception {
        when(uplinkService.clearImages())
                .thenReturn(new ClearImagesResponse(4, 3, "All generated sample images were cleared"));

        mockMvc.perform(post("/images/clear").header("x-api-key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedCount").value(4))
                .andExpect(jsonPath("$.clearedCommandCount").value(3));
    }
}
