package com.jobscout.discovery.browser;

import com.jobscout.config.DiscoveryProperties;
import org.springframework.stereotype.Component;

@Component
public class PlaywrightSessionFactory implements BrowserSessionFactory {
    private final DiscoveryProperties properties;

    public PlaywrightSessionFactory(DiscoveryProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSession open() {
        return new PlaywrightBrowserSession(properties.getBrowser(), properties.getBrowser().isHeadless());
    }

    @Override
    public BrowserSession openVisible() {
        return new PlaywrightBrowserSession(properties.getBrowser(), false);
    }
}
