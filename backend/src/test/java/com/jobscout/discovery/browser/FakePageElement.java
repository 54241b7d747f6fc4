package com.jobscout.discovery.browser;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

class FakePageElement implements PageElement {
    private final Element element;

    FakePageElement(Element element) {
        this.element = element;
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public String attribute(String name) {
        return element.hasAttr(name) ? element.attr(name) : null;
    }

    @Override
    public List<PageElement> findAll(String selector) {
        List<PageElement> out = new ArrayList<>();
        for (Element match : element.select(selector)) {
            out.add(new FakePageElement(match));
        }
        return out;
    }

    @Override
    public void scrollIntoView() {
    }

    @Override
    public void hover() {
    }
}
