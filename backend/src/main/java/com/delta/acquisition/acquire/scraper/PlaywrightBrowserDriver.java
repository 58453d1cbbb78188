package com.delta.acquisition.acquire.scraper;

import com.delta.acquisition.acquire.http.ProxyEndpoint;
import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.acquire.pool.PoolRetirementListener;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Headless Chromium through Playwright. Playwright objects are not thread-safe, so every session owns its own
 * Playwright instance and browser. Cookies and local storage are carried between sessions that lease the same
 * session id.
 */
@Component
public class PlaywrightBrowserDriver implements BrowserDriver, PoolRetirementListener {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserDriver.class);

    static final List<String> LAUNCH_ARGS = List.of(
        "--disable-blink-features=AutomationControlled",
        "--disable-dev-shm-usage",
        "--no-sandbox",
        "--disable-setuid-sandbox",
        "--disable-background-networking",
        "--disable-background-timer-throttling",
        "--disable-renderer-backgrounding",
        "--disable-backgrounding-occluded-windows",
        "--disable-client-side-phishing-detection",
        "--disable-crash-reporter",
        "--no-crash-upload",
        "--disable-gpu",
        "--disable-extensions"
    );

    static final String INIT_SCRIPT = """
        Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
        window.chrome = { runtime: {}, loadTimes: function() {}, csi: function() {}, app: {} };
        const originalQuery = window.navigator.permissions.query;
        window.navigator.permissions.query = (parameters) => (
            parameters.name === 'notifications'
                ? Promise.resolve({ state: Notification.permission })
                : originalQuery(parameters)
        );
        Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
        Object.defineProperty(navigator, 'languages', { get: () => ['en-US', 'en'] });
        """;

    private static final Map<String, String> EXTRA_HEADERS = Map.of(
        "Accept-Language", "en-US,en;q=0.9",
        "Upgrade-Insecure-Requests", "1"
    );

    private final Map<String, String> storageStates = new ConcurrentHashMap<>();

    @Override
    public BrowserSession open(BrowserProfile profile) {
        Playwright playwright = Playwright.create();
        try {
            BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                .setHeadless(profile.headless())
                .setArgs(LAUNCH_ARGS);
            if (profile.hasProxy()) {
                ProxyEndpoint proxy = ProxyEndpoint.parse(profile.proxy());
                if (proxy != null) {
                    launchOptions.setProxy(toPlaywrightProxy(proxy));
                }
            }
            Browser browser = playwright.chromium().launch(launchOptions);

            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
                .setViewportSize(profile.viewportWidth(), profile.viewportHeight())
                .setLocale("en-US")
                .setExtraHTTPHeaders(EXTRA_HEADERS);
            if (profile.userAgent() != null && !profile.userAgent().isBlank()) {
                contextOptions.setUserAgent(profile.userAgent());
            }
            if (profile.hasSession()) {
                String state = storageStates.get(profile.sessionId());
                if (state != null) {
                    contextOptions.setStorageState(state);
                }
            }
            BrowserContext context = browser.newContext(contextOptions);
            context.addInitScript(INIT_SCRIPT);
            Page page = context.newPage();
            return new PlaywrightSession(playwright, browser, context, page, profile.sessionId());
        } catch (RuntimeException e) {
            closeQuietly(playwright);
            throw e;
        }
    }

    @Override
    public void retired(ResourceKind kind, String value) {
        if (kind == ResourceKind.SESSION && value != null && storageStates.remove(value) != null) {
            log.debug("Dropped stored browser state for retired session {}", value);
        }
    }

    int storedSessionCount() {
        return storageStates.size();
    }

    static Proxy toPlaywrightProxy(ProxyEndpoint endpoint) {
        Proxy proxy = new Proxy(endpoint.server());
        if (endpoint.hasCredentials()) {
            proxy.setUsername(endpoint.username());
            proxy.setPassword(endpoint.password() == null ? "" : endpoint.password());
        }
        return proxy;
    }

    void rememberStorageState(String sessionId, String state) {
        storageStates.put(sessionId, state);
    }

    private static void closeQuietly(Playwright playwright) {
        try {
            playwright.close();
        } catch (RuntimeException e) {
            log.debug("Error closing Playwright: {}", e.getMessage());
        }
    }

    private final class PlaywrightSession implements BrowserSession {
        private final Playwright playwright;
        private final Browser browser;
        private final BrowserContext context;
        private final Page page;
        private final String sessionId;

        private PlaywrightSession(
            Playwright playwright,
            Browser browser,
            BrowserContext context,
            Page page,
            String sessionId
        ) {
            this.playwright = playwright;
            this.browser = browser;
            this.context = context;
            this.page = page;
            this.sessionId = sessionId;
        }

        @Override
        public NavigationResult navigate(String url, Duration timeout) {
            try {
                Response response = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(timeout.toMillis()));
                return new NavigationResult(response == null ? 0 : response.status(), page.url());
            } catch (TimeoutError e) {
                throw new BrowserNavigationException(ReasonCodeClassifier.TIMEOUT, e.getMessage(), e);
            } catch (PlaywrightException e) {
                String reason = ReasonCodeClassifier.fromErrorCode("navigation_error", e.getMessage());
                throw new BrowserNavigationException(reason, e.getMessage(), e);
            }
        }

        @Override
        public String content() {
            return page.content();
        }

        @Override
        public byte[] screenshot() {
            return page.screenshot(new Page.ScreenshotOptions().setFullPage(false));
        }

        @Override
        public void movePointer(double x, double y) {
            page.mouse().move(x, y);
        }

        @Override
        public void click(double x, double y) {
            page.mouse().click(x, y);
        }

        @Override
        public void close() {
            if (sessionId != null && !sessionId.isBlank()) {
                try {
                    rememberStorageState(sessionId, context.storageState());
                } catch (RuntimeException e) {
                    log.debug("Could not save storage state for session {}: {}", sessionId, e.getMessage());
                }
            }
            try {
                context.close();
                browser.close();
            } catch (RuntimeException e) {
                log.debug("Error closing browser: {}", e.getMessage());
            } finally {
                closeQuietly(playwright);
            }
        }
    }
}
