package io.github.jakubt4.satti.client;

import io.github.jakubt4.satti.exception.TileFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OsmTileClientTest {

    private static final String BASE_URL = "http://tiles.test";
    private static final String USER_AGENT = "satti-sim/test";

    private OsmTileClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new OsmTileClient(builder, BASE_URL, USER_AGENT);
    }

    @Test
    void fetchTileRequestsSlippyPathWithUserAgent() throws Exception {
        mockServer.expect(requestTo(BASE_URL + "/3/5/2.png"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.USER_AGENT, USER_AGENT))
                .andRespond(withSuccess(png(256, 256), MediaType.IMAGE_PNG));

        final var tile = client.fetchTile(3, 5, 2);

        assertThat(tile.getWidth()).isEqualTo(256);
        mockServer.verify();
    }

    @Test
    void fetchTileWrapsXAndClampsY() throws Exception {
        mockServer.expect(requestTo(BASE_URL + "/2/3/3.png"))
                .andRespond(withSuccess(png(256, 256), MediaType.IMAGE_PNG));
        mockServer.expect(requestTo(BASE_URL + "/2/0/0.png"))
                .andRespond(withSuccess(png(256, 256), MediaType.IMAGE_PNG));

        client.fetchTile(2, -1, 9);
        client.fetchTile(2, 4, -1);

        mockServer.verify();
    }

    @Test
    void serverErrorBecomesTileFetchException() {
        mockServer.expect(requestTo(BASE_URL + "/4/1/1.png"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchTile(4, 1, 1))
                .isInstanceOf(TileFetchException.class)
                .hasMessageStartingWith("External map tile fetch failed");
    }

    @Test
    void undecodableBodyBecomesTileFetchException() {
        mockServer.expect(requestTo(BASE_URL + "/4/1/1.png"))
                .andRespond(withSuccess("<html>rate limited</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.fetchTile(4, 1, 1))
                .isInstanceOf(TileFetchException.class)
                .hasMessageContaining("not a decodable image");
    }

    private static byte[] png(final int width, final int height) throws IOException {
        final var buffer = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "PNG", buffer);
        return buffer.toByteArray();
    }
}
