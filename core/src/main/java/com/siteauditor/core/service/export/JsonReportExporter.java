package com.siteauditor.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;

/** 기계 판독용 report.json (Jackson) */
public class JsonReportExporter implements ReportExporter {

    private static final ObjectMapper MAPPER = mapper();

    static ObjectMapper mapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String fileName() { return ReportNaming.JSON_FILE; }

    @Override
    public Path export(ReportModel model, Path dir) throws IOException {
        Path out = dir.resolve(fileName());
        MAPPER.writeValue(out.toFile(), model);
        return out;
    }

    /** 요약만 들여쓰기 JSON으로 (CLI 프리뷰) */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalStateException("could not serialise " + value.getClass().getSimpleName(), e);
        }
    }
}
