package com.jobscout.discovery.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobscout.discovery.model.ResolvedJob;
import com.jobscout.discovery.model.StoredJob;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

@Service
public class JobExportService {
    private static final String[] CSV_HEADERS = {
        "title",
        "company",
        "location",
        "salary",
        "posted",
        "apply_url",
        "listing_url",
        "ats_vendor",
        "resolved",
        "keyword",
        "page",
        "first_seen_at",
        "applied",
        "fingerprint"
    };

    public enum Format {
        CSV,
        JSON;

        public static Format parse(String value) {
            if (value == null || value.isBlank()) {
                return CSV;
            }
            return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final ObjectMapper objectMapper;

    public JobExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public int export(List<StoredJob> jobs, Path target, Format format) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (format == Format.JSON) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), jobs);
            return jobs.size();
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeCsv(jobs, writer);
        }
        return jobs.size();
    }

    void writeCsv(List<StoredJob> jobs, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADERS)
            .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (StoredJob stored : jobs) {
                ResolvedJob job = stored.job();
                printer.printRecord(
                    job.title(),
                    job.company(),
                    job.location(),
                    job.salary(),
                    job.postedText(),
                    job.applyUrl(),
                    job.listingUrl(),
                    job.atsVendor(),
                    job.resolved(),
                    job.sourceKeyword(),
                    job.sourcePage(),
                    stored.firstSeenAt(),
                    stored.applied(),
                    job.fingerprint()
                );
            }
        }
    }
}
