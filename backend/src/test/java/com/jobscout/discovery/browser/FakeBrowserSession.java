package com.jobscout.discovery.browser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory browser session over canned HTML pages. Clicks follow behaviors registered per raw
 * href; tabs are counted so tests can assert that nothing leaks.
 */
public class FakeBrowserSession implements BrowserSession {
    private static final String BLANK_PAGE = "<html><head><title></title></head><body></body></html>";

    public interface ClickBehavior {
        ClickOutcome click(FakeBrowserSession session);
    }

    public static ClickBehavior opensTab(String url) {
        return session -> {
            session.extraTabs++;
            return ClickOutcome.newTab(new FakeTab(session, url));
        };
    }

    public static ClickBehavior opensTabWithPopup(String url) {
        return session -> {
            session.extraTabs += 2;
            return ClickOutcome.newTab(new FakeTab(session, url));
        };
    }

    public static ClickBehavior navigatesTo(String url) {
        return session -> {
            session.load(url);
            return ClickOutcome.navigated(url);
        };
    }

    public static ClickBehavior doesNothing() {
        return session -> ClickOutcome.none();
    }

    public static ClickBehavior fails(RuntimeException error) {
        return session -> {
            throw error;
        };
    }

    private final Map<String, String> pages;
    private final Map<String, ClickBehavior> clicks;
    private final List<String> navigations = new ArrayList<>();
    private final List<BrowserCookie> cookies = new ArrayList<>();
    private Document document;
    private String currentUrl = "about:blank";
    private int extraTabs;
    private int clickCount;
    private boolean closed;

    public FakeBrowserSession(Map<String, String> pages, Map<String, ClickBehavior> clicks) {
        this.pages = pages;
        this.clicks = clicks;
        this.document = Jsoup.parse(BLANK_PAGE);
    }

    public FakeBrowserSession(Map<String, String> pages) {
        this(pages, new HashMap<>());
    }

    @Override
    public void navigate(String url) {
        navigations.add(url);
        load(url);
    }

    void load(String url) {
        currentUrl = url;
        document = Jsoup.parse(pages.getOrDefault(url, BLANK_PAGE), url);
        document.outputSettings().prettyPrint(false);
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public String title() {
        return document.title();
    }

    @Override
    public String content() {
        return document.outerHtml();
    }

    @Override
    public String bodyText() {
        return document.body() == null ? "" : document.body().text();
    }

    @Override
    public boolean hasElement(String selector) {
        return !document.select(selector).isEmpty();
    }

    @Override
    public Optional<PageElement> querySelector(String selector) {
        Element element = document.selectFirst(selector);
        return element == null ? Optional.empty() : Optional.of(new FakePageElement(element));
    }

    @Override
    public ClickOutcome clickAndAwait(PageElement target, Duration timeout) {
        clickCount++;
        ClickBehavior behavior = clicks.get(target.attribute("href"));
        if (behavior == null) {
            return ClickOutcome.none();
        }
        return behavior.click(this);
    }

    @Override
    public int openTabCount() {
        return 1 + extraTabs;
    }

    @Override
    public int closeExtraTabs() {
        int closedTabs = extraTabs;
        extraTabs = 0;
        return closedTabs;
    }

    @Override
    public List<BrowserCookie> cookies() {
        return new ArrayList<>(cookies);
    }

    @Override
    public void addCookies(List<BrowserCookie> added) {
        cookies.addAll(added);
    }

    @Override
    public void close() {
        closed = true;
    }

    void tabClosed() {
        extraTabs = Math.max(0, extraTabs - 1);
    }

    public List<String> navigations() {
        return navigations;
    }

    public int clickCount() {
        return clickCount;
    }

    public boolean isClosed() {
        return closed;
    }
}
