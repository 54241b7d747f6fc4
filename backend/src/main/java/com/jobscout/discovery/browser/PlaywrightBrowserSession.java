package com.jobscout.discovery.browser;

import com.jobscout.config.DiscoveryProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Dialog;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

class PlaywrightBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final int navigationTimeoutMs;

    PlaywrightBrowserSession(DiscoveryProperties.Browser settings, boolean headless) {
        this.navigationTimeoutMs = settings.getNavigationTimeoutMs();
        this.playwright = Playwright.create();
        try {
            this.browser = playwright.chromium().launch(
                new BrowserType.LaunchOptions()
                    .setHeadless(headless)
                    .setArgs(List.of("--disable-blink-features=AutomationControlled"))
            );
            this.context = browser.newContext(
                new Browser.NewContextOptions()
                    .setUserAgent(settings.getUserAgent())
                    .setLocale(settings.getLocale())
                    .setViewportSize(settings.getViewportWidth(), settings.getViewportHeight())
            );
            context.setDefaultTimeout(navigationTimeoutMs);
            this.page = context.newPage();
            page.onDialog(Dialog::dismiss);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new BrowserOperationException("Failed to launch browser", e);
        }
    }

    @Override
    public void navigate(String url) {
        try {
            page.navigate(
                url,
                new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(navigationTimeoutMs)
            );
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Navigation failed: " + url, e);
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public String title() {
        try {
            return page.title();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to read page title", e);
        }
    }

    @Override
    public String content() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to read page content", e);
        }
    }

    @Override
    public String bodyText() {
        try {
            return page.innerText("body");
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to read page body", e);
        }
    }

    @Override
    public boolean hasElement(String selector) {
        try {
            return page.querySelector(selector) != null;
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to query " + selector, e);
        }
    }

    @Override
    public Optional<PageElement> querySelector(String selector) {
        try {
            ElementHandle handle = page.querySelector(selector);
            return handle == null ? Optional.empty() : Optional.of(new PlaywrightPageElement(handle));
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to query " + selector, e);
        }
    }

    @Override
    public ClickOutcome clickAndAwait(PageElement target, Duration timeout) {
        if (!(target instanceof PlaywrightPageElement element)) {
            throw new IllegalArgumentException("Element does not belong to a Playwright session");
        }
        String before = page.url();
        List<Page> opened = new ArrayList<>();
        Consumer<Page> onPage = opened::add;
        context.onPage(onPage);
        try {
            element.handle().click(new ElementHandle.ClickOptions().setTimeout(timeout.toMillis()));
            page.waitForCondition(
                () -> !opened.isEmpty() || !before.equals(page.url()),
                new Page.WaitForConditionOptions().setTimeout(timeout.toMillis())
            );
        } catch (TimeoutError e) {
            log.debug("Click on {} produced no tab or navigation within {}", before, timeout);
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Click failed on " + before, e);
        } finally {
            context.offPage(onPage);
        }
        if (!opened.isEmpty()) {
            return ClickOutcome.newTab(new PlaywrightBrowserTab(opened.get(0)));
        }
        String after = page.url();
        if (!before.equals(after)) {
            return ClickOutcome.navigated(after);
        }
        return ClickOutcome.none();
    }

    @Override
    public int openTabCount() {
        return context.pages().size();
    }

    @Override
    public int closeExtraTabs() {
        int closed = 0;
        for (Page other : new ArrayList<>(context.pages())) {
            if (other == page || other.isClosed()) {
                continue;
            }
            try {
                other.close();
                closed++;
            } catch (PlaywrightException e) {
                throw new BrowserOperationException("Failed to close extra tab", e);
            }
        }
        return closed;
    }

    @Override
    public List<BrowserCookie> cookies() {
        List<BrowserCookie> out = new ArrayList<>();
        for (Cookie cookie : context.cookies()) {
            out.add(new BrowserCookie(
                cookie.name,
                cookie.value,
                cookie.domain,
                cookie.path,
                cookie.expires == null ? -1 : cookie.expires,
                Boolean.TRUE.equals(cookie.httpOnly),
                Boolean.TRUE.equals(cookie.secure),
                cookie.sameSite == null ? null : cookie.sameSite.name()
            ));
        }
        return out;
    }

    @Override
    public void addCookies(List<BrowserCookie> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            return;
        }
        List<Cookie> converted = new ArrayList<>();
        for (BrowserCookie cookie : cookies) {
            Cookie target = new Cookie(cookie.name(), cookie.value())
                .setDomain(cookie.domain())
                .setPath(cookie.path() == null ? "/" : cookie.path())
                .setExpires(cookie.expires())
                .setHttpOnly(cookie.httpOnly())
                .setSecure(cookie.secure());
            if (cookie.sameSite() != null) {
                target.setSameSite(SameSiteAttribute.valueOf(cookie.sameSite().toUpperCase(Locale.ROOT)));
            }
            converted.add(target);
        }
        try {
            context.addCookies(converted);
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to install cookies", e);
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser cleanly", e);
        } finally {
            playwright.close();
        }
    }
}
