package io.waypost.javalin.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.javalin.http.Context;
import io.waypost.core.spi.TransportResponse;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("JavalinTransport response writing")
class JavalinTransportTest {

    @Test
    @DisplayName("status, content type, headers and body are copied onto the context")
    void writesResponse() {
        Context ctx = mock(Context.class);
        HttpServletResponse res = mock(HttpServletResponse.class);
        when(ctx.res()).thenReturn(res);
        byte[] body = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);

        JavalinTransport.write(
                new TransportResponse(201, "application/json", body, Map.of("X-Id", "7"), Map.of(), Set.of()), ctx);

        verify(ctx).status(201);
        verify(ctx).contentType("application/json");
        verify(ctx).header("X-Id", "7");
        verify(ctx).result(body);
    }

    @Test
    @DisplayName("set cookies get path '/'; cleared cookies expire immediately")
    void writesCookies() {
        Context ctx = mock(Context.class);
        HttpServletResponse res = mock(HttpServletResponse.class);
        when(ctx.res()).thenReturn(res);

        JavalinTransport.write(
                new TransportResponse(200, "text/plain", new byte[0], Map.of(), Map.of("session", "abc"),
                        Set.of("old")),
                ctx);

        ArgumentCaptor<Cookie> cookies = ArgumentCaptor.forClass(Cookie.class);
        verify(res, times(2)).addCookie(cookies.capture());
        List<Cookie> written = cookies.getAllValues();
        assertThat(written.get(0).getName()).isEqualTo("session");
        assertThat(written.get(0).getValue()).isEqualTo("abc");
        assertThat(written.get(0).getPath()).isEqualTo("/");
        assertThat(written.get(1).getName()).isEqualTo("old");
        assertThat(written.get(1).getMaxAge()).isZero();
    }

    @Test
    @DisplayName("port before start → IllegalStateException")
    void portBeforeStart() {
        assertThatThrownBy(() -> new JavalinTransport().port())
                .isInstanceOf(IllegalStateException.class);
    }
}
