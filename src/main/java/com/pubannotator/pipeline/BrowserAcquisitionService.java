package com.pubannotator.pipeline;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Acquisition source fetching pages with a headless Playwright browser.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads the URL list file: one URL per line, blank lines and {@code #} comments ignored.</li>
 *   <li>Opens each URL in a fresh page, waits for the DOM to load, then takes the page title and
 *       the {@code innerText} of {@code body}.</li>
 *   <li>A page that fails to load is logged and left out; the rest of the list is still fetched.</li>
 * </ul>
 * The natural key of each record is the requested URL; the page title goes into metadata.
 */
public class BrowserAcquisitionService implements AcquisitionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(BrowserAcquisitionService.class);
    private static final double NAVIGATION_TIMEOUT_MS = 30_000;

    private final Path urlList;

    public BrowserAcquisitionService(Path urlList) {
        this.urlList = urlList;
    }

    @Override
    public List<RawRecord> acquire() throws IOException {
        List<String> urls = readUrlList(urlList);
        List<RawRecord> records = new ArrayList<>();
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
            try {
                for (String url : urls) {
                    RawRecord record = fetch(browser, url);
                    if (record != null) records.add(record);
                }
            } finally {
                browser.close();
            }
        } catch (PlaywrightException e) {
            throw new IOException("Browser acquisition failed: " + e.getMessage(), e);
        }
        logger.info("Fetched {} of {} pages listed in {}.", records.size(), urls.size(), urlList);
        return records;
    }

    private RawRecord fetch(Browser browser, String url) {
        Page page = browser.newPage();
        try {
            page.setDefaultNavigationTimeout(NAVIGATION_TIMEOUT_MS);
            page.navigate(url);
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            String title = page.title();
            String text = page.locator("body").innerText();
            Map<String, String> metadata = new LinkedHashMap<>();
            if (title != null && !title.isBlank()) metadata.put("pageTitle", title.trim());
            logger.debug("Fetched {} ({} chars).", url, text == null ? 0 : text.length());
            return new RawRecord(null, url, text == null ? "" : text.trim(), page.url(), metadata);
        } catch (PlaywrightException e) {
            logger.warn("Failed to fetch {}: {}", url, e.getMessage());
            return null;
        } finally {
            page.close();
        }
    }

    /**
     * Reads the URL list file, dropping blank lines and {@code #} comments.
     */
    static List<String> readUrlList(Path file) throws IOException {
        List<String> urls = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            urls.add(trimmed);
        }
        return urls;
    }

    @Override
    public String describe() {
        return "browser:" + urlList;
    }
}
