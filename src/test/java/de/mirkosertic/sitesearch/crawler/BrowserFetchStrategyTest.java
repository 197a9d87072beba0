package de.mirkosertic.sitesearch.crawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("BrowserFetchStrategy Tests")
class BrowserFetchStrategyTest {

    private static final String URL = "https://example.com/";

    private BrowserSession session;
    private BrowserFetchStrategy strategy;

    @BeforeEach
    void setUp() {
        session = mock(BrowserSession.class);
        strategy = new BrowserFetchStrategy(() -> session);
    }

    @Test
    @DisplayName("Should navigate, wait for network idle and read the rendered DOM")
    void shouldRenderPage() throws Exception {
        when(session.pageSource()).thenReturn("<html><body>rendered</body></html>");

        final String html = strategy.fetch(URL);

        assertThat(html).contains("rendered");
        final InOrder order = inOrder(session);
        order.verify(session).navigate(URL);
        order.verify(session).awaitNetworkIdle();
        order.verify(session).pageSource();
        order.verify(session).close();
    }

    @Test
    @DisplayName("The browser session must be closed when navigation fails")
    void shouldCloseSessionOnFailure() throws Exception {
        doThrow(new FetchException("Page load timed out: " + URL)).when(session).navigate(URL);

        assertThatThrownBy(() -> strategy.fetch(URL))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("timed out");
        verify(session).close();
        verify(session, never()).pageSource();
    }

    @Test
    @DisplayName("A browser that cannot start is reported as unavailable")
    void shouldPropagateUnavailableBrowser() {
        final BrowserFetchStrategy unavailable = new BrowserFetchStrategy(() -> {
            throw new BrowserUnavailableException("Chrome could not be started", null);
        });

        assertThatThrownBy(() -> unavailable.fetch(URL))
                .isInstanceOf(BrowserUnavailableException.class);
    }

    @Test
    @DisplayName("The browser language is the first Accept-Language entry")
    void shouldDerivePrimaryLanguage() {
        assertThat(SeleniumBrowserSession.primaryLanguage("en-US,en;q=0.9")).isEqualTo("en-US");
        assertThat(SeleniumBrowserSession.primaryLanguage("de;q=0.8")).isEqualTo("de");
    }
}
