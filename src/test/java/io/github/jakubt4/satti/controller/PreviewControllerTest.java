package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.exception.TileFetchException;
import io.github.jakubt4.satti.service.imaging.ImageSynthesisService;
import io.github.jakubt4.satti.service.imaging.MapMosaicSynthesizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.awt.image.BufferedImage;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PreviewController.class)
class PreviewControllerTest {

    private static final String API_KEY = "change-me";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MapMosaicSynthesizer mapMosaicSynthesizer;

    @MockBean
    private ImageSynthesisService imageSynthesisService;

    @Test
    void previewUsesDefaultsAndReturnsPng() throws Exception {
        final var image = new BufferedImage(768, 768, BufferedImage.TYPE_INT_RGB);
        when(mapMosaicSynthesizer.render(35.1, 129.04, 19, 768, 768, "OSM")).thenReturn(image);
        when(imageSynthesisService.encode(image)).thenReturn(new byte[]{1, 2, 3});

        mockMvc.perform(get("/preview/external-map")
                        .header("x-api-key", API_KEY)
                        .param("lat", "35.1")
                        .param("lon", "129.04"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(new byte[]{1, 2, 3}));

        verify(mapMosaicSynthesizer).render(35.1, 129.04, 19, 768, 768, "OSM");
    }

    @Test
    void outOfRangeParametersAreBadRequest() throws Exception {
        mockMvc.perform(get("/preview/external-map")
                        .header("x-api-key", API_KEY)
                        .param("lat", "95")
                        .param("lon", "129")
                        .param("zoom", "22")
                        .param("width", "64"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("lat must be between -90 and 90")))
                .andExpect(jsonPath("$.message", containsString("zoom must be between 1 and 19")))
                .andExpect(jsonPath("$.message", containsString("width must be between 128 and 4096")));

        verifyNoInteractions(mapMosaicSynthesizer);
    }

    @Test
    void unsupportedSourceIsBadRequest() throws Exception {
        mockMvc.perform(get("/preview/external-map")
                        .header("x-api-key", API_KEY)
                        .param("lat", "35.1")
                        .param("lon", "129.04")
                        .param("source", "GOOGLE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported external map source: GOOGLE"));
    }

    @Test
    void missingCoordinatesAreBadRequest() throws Exception {
        mockMvc.perform(get("/preview/external-map").header("x-api-key", API_KEY))
                .andExpect(status().isBadRequest());
    }

    @Test
    void tileFailureIsBadGateway() throws Exception {
        when(mapMosaicSynthesizer.render(anyDouble(), anyDouble(), anyInt(), anyInt(), anyInt(), anyString()))
                .thenThrow(new TileFetchException("External map tile fetch failed: 503 Service Unavailable"));

        mockMvc.perform(get("/preview/external-map")
                        .header("x-api-key", API_KEY)
                        .param("lat", "35.1")
                        .param("lon", "129.04")
                        .param("zoom", "12"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("BAD_GATEWAY"))
                .andExpect(jsonPath("$.message", startsWith("External map preview failed: ")));

        verify(mapMosaicSynthesizer).render(eq(35.1), eq(129.04), eq(12), anyInt(), anyInt(), any());
    }
}
