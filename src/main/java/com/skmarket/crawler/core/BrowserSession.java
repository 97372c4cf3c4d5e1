package com.skmarket.crawler.core;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Playwright-backed session: one Chromium process with a single context and page.
 * Must be started, used and closed on the same thread.
 */
@Slf4j
@RequiredArgsConstructor
public class BrowserSession implements PageSession {
    private final Config.Browser config;
    @Getter private Playwright playwright;
    @Getter private Browser browser;
    @Getter private BrowserContext context;
    @Getter private Page page;

    public void start() {
        try {
            playwright = Playwright.create();
            BrowserType chromium = playwright.chromium();
            browser = chromium.launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));
            context = browser.newContext(new Browser.NewContextOptions()
                .setViewportSize(config.getViewportWidth(), config.getViewportHeight()));
            List<String> blocked = config.getBlockedResourceTypes();
            if (blocked != null && !blocked.isEmpty()) {
                context.route("**/*", route -> {
                    if (blocked.contains(route.request().resourceType())) {
                        route.abort();
                    } else {
                        route.resume();
                    }
                });
            }
            page = context.newPage();
        } catch (PlaywrightException e) {
            close();
            throw new CrawlerException("Could not start browser session: " + e.getMessage(), e);
        }
    }

    @Override
    public void navigate(String url, long timeoutMs) {
        call("navigate " + url, () -> page.navigate(url, new Page.NavigateOptions().setTimeout(timeoutMs)));
    }

    @Override
    public void waitForNetworkIdle(long timeoutMs) {
        call("network idle", () -> {
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
            return null;
        });
    }

    @Override
    public void waitFor(String selector, long timeoutMs, WaitState state) {
        call("wait for " + selector, () -> page.waitForSelector(selector, new Page.WaitForSelectorOptions()
            .setState(toPlaywright(state))
            .setTimeout(timeoutMs)));
    }

    @Override
    public List<PageElement> queryAll(String selector) {
        return call("query all " + selector, () -> page.querySelectorAll(selector).stream()
            .<PageElement>map(Element::new)
            .toList());
    }

    @Override
    public Optional<PageElement> query(String selector) {
        return call("query " + selector, () -> Optional.ofNullable(page.querySelector(selector)).map(Element::new));
    }

    @Override
    public void close() {
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser cleanly: {}", e.getMessage());
        } finally {
            if (playwright != null) playwright.close();
            context = null;
            browser = null;
            playwright = null;
        }
    }

    private static WaitForSelectorState toPlaywright(WaitState state) {
        return switch (state) {
            case ATTACHED -> WaitForSelectorState.ATTACHED;
            case VISIBLE -> WaitForSelectorState.VISIBLE;
            case HIDDEN -> WaitForSelectorState.HIDDEN;
        };
    }

    private static <T> T call(String opName, Supplier<T> action) {
        try {
            return action.get();
        } catch (TimeoutError e) {
            throw new NavigationTimeoutException(opName + " timed out: " + e.getMessage(), e);
        } catch (PlaywrightException e) {
            throw new CrawlerException(opName + " failed: " + e.getMessage(), e);
        }
    }

    @RequiredArgsConstructor
    private static class Element implements PageElement {
        private final ElementHandle handle;

        @Override
        public Optional<String> textContent() {
            return call("text content", () -> Optional.ofNullable(handle.textContent()));
        }

        @Override
        public Optional<String> getAttribute(String name) {
            return call("attribute " + name, () -> Optional.ofNullable(handle.getAttribute(name)));
        }

        @Override
        public void click() {
            call("click", () -> {
                handle.click();
                return null;
            });
        }

        @Override
        public Optional<PageElement> query(String selector) {
            return call("query " + selector, () -> Optional.ofNullable(handle.querySelector(selector)).map(Element::new));
        }
    }
}
