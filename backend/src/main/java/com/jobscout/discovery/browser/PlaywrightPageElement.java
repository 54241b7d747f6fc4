package com.jobscout.discovery.browser;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.PlaywrightException;

import java.util.ArrayList;
import java.util.List;

class PlaywrightPageElement implements PageElement {
    private final ElementHandle handle;

    PlaywrightPageElement(ElementHandle handle) {
        this.handle = handle;
    }

    ElementHandle handle() {
        return handle;
    }

    @Override
    public String text() {
        try {
            return handle.innerText();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to read element text", e);
        }
    }

    @Override
    public String attribute(String name) {
        try {
            return handle.getAttribute(name);
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to read attribute " + name, e);
        }
    }

    @Override
    public List<PageElement> findAll(String selector) {
        try {
            List<PageElement> out = new ArrayList<>();
            for (ElementHandle child : handle.querySelectorAll(selector)) {
                out.add(new PlaywrightPageElement(child));
            }
            return out;
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to query " + selector, e);
        }
    }

    @Override
    public void scrollIntoView() {
        try {
            handle.scrollIntoViewIfNeeded();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to scroll element into view", e);
        }
    }

    @Override
    public void hover() {
        try {
            handle.hover();
        } catch (PlaywrightException e) {
            throw new BrowserOperationException("Failed to hover element", e);
        }
    }
}
