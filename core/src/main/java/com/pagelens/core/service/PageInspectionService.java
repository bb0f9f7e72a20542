package com.pagelens.core.service;

import com.pagelens.core.analyzer.CanonicalAnalyzer;
import com.pagelens.core.analyzer.ContentVisibilityAssessor;
import com.pagelens.core.analyzer.HeadingAnalyzer;
import com.pagelens.core.analyzer.ImageAltAnalyzer;
import com.pagelens.core.analyzer.MetaDescriptionAnalyzer;
import com.pagelens.core.analyzer.TitleAnalyzer;
import com.pagelens.core.api.IDocumentParser;
import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.api.PageDocument;
import com.pagelens.core.dom.JsoupDocumentParser;
import com.pagelens.core.http.HttpPageFetcher;
import com.pagelens.core.model.DecodedText;
import com.pagelens.core.model.FetchOutcome;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.PageReport;
import com.pagelens.core.model.RawResponse;
import com.pagelens.core.text.EncodingResolver;
import com.pagelens.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * 점검 오케스트레이터:
 *  - fetch → decode → parse → 분석기 6종(고정 순서) → PageReport
 *  - 기본 구현체(HttpPageFetcher/JsoupDocumentParser)
 *  - DI 생성자는 테스트/대체 파서 주입용
 */
public final class PageInspectionService {

    private static final Logger LOG = LoggerFactory.getLogger(PageInspectionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageInspectionService.class);

    private final IPageFetcher fetcher;
    private final IDocumentParser parser;
    private final EncodingResolver encodingResolver;
    private final ContentVisibilityAssessor visibility;
    private final TitleAnalyzer title = new TitleAnalyzer();
    private final MetaDescriptionAnalyzer metaDescription = new MetaDescriptionAnalyzer();
    private final HeadingAnalyzer heading;
    private final ImageAltAnalyzer imageAlt = new ImageAltAnalyzer();
    private final CanonicalAnalyzer canonical = new CanonicalAnalyzer();

    public PageInspectionService(InspectConfig config) {
        this(config, new HttpPageFetcher(config), new JsoupDocumentParser());
    }

    public PageInspectionService(InspectConfig config, IPageFetcher fetcher, IDocumentParser parser) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.encodingResolver = new EncodingResolver(config.encoding());
        this.visibility = new ContentVisibilityAssessor(config.visibility());
        this.heading = new HeadingAnalyzer(config.heading());
    }

    public FetchOutcome fetch(String url) {
        return fetcher.fetch(url);
    }

    /** 페치 실패 시 empty */
    public Optional<PageReport> inspect(String url) {
        FetchOutcome outcome = fetch(url);
        if (!outcome.isSuccess()) {
            LOG.info("No document to analyze for {} ({})", url, outcome.getFailure());
            return Optional.empty();
        }
        return outcome.getResponse().map(this::analyze);
    }

    /** 이미 받은 응답에 대해 동일 파이프라인 실행 */
    public PageReport analyze(RawResponse raw) {
        Objects.requireNonNull(raw, "raw");
        String url = raw.getSourceUrl();

        DecodedText decoded = encodingResolver.resolve(raw);
        if (decoded.isDegraded()) {
            LOG.warn("Decoding of {} degraded to {} ({})", url, decoded.getCharset(), decoded.getStage());
        }
        PageDocument doc = parser.parse(decoded.getText(), url);

        PageReport.Builder report = PageReport.builder()
                .url(url)
                .response(raw)
                .decoded(decoded);

        FieldResult visible = visibility.assess(doc);
        report.add(visible);
        if (!visible.isVerdict()) {
            LOG.info("Initial content looks insufficient for {}; later checks may be less reliable", url);
        }
        report.add(title.analyze(doc));
        report.add(metaDescription.analyze(doc));
        report.add(heading.analyze(doc, TitleAnalyzer.extractTitle(doc).orElse("")));
        report.add(imageAlt.analyze(doc));
        report.add(canonical.analyze(doc, url));

        PageReport built = report.build();
        SLOG.info("inspect-done", "url", url, "charset", decoded.getCharset(),
                "stage", decoded.getStage(), "contentVisible", built.isContentVisible());
        return built;
    }
}
