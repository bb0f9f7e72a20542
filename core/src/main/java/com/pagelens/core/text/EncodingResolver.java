package com.pagelens.core.text;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import com.pagelens.core.model.DecodeStage;
import com.pagelens.core.model.DecodedText;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.RawResponse;
import com.pagelens.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 응답 바이트 → 문자열 디코딩 체인.
 *  1) 선언 charset 엄격 디코딩
 *  2) 실패 시 사이트 힌트: 중국어 사이트면 GBK, 아니면 UTF-8 (엄격)
 *  3) 선언이 없으면 앞 N바이트 통계 감지(ICU), 신뢰도 초과 시 치환 디코딩
 *  4) 그 외/실패 → 후보 목록 순서대로 엄격 디코딩
 *  5) 전부 실패 → UTF-8 손실 디코딩(잘못된 시퀀스 제거)
 * 어떤 입력에도 예외를 던지지 않는다.
 */
public final class EncodingResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EncodingResolver.class);
    private static final StructuredLog SLOG = StructuredLog.get(EncodingResolver.class);

    private static final String GBK = "GBK";
    private static final String UTF_8 = "UTF-8";

    private final List<String> cjkSiteHints;
    private final int sampleBytes;
    private final double minConfidence;
    private final List<String> cjkCandidates;
    private final List<String> defaultCandidates;

    public EncodingResolver(InspectConfig.EncodingCfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.cjkSiteHints = lower(cfg.getCjkSiteHints());
        this.sampleBytes = Math.max(1, cfg.getDetectionSampleBytes());
        this.minConfidence = cfg.getMinConfidence();
        this.cjkCandidates = List.copyOf(cfg.getCjkCandidates());
        this.defaultCandidates = List.copyOf(cfg.getDefaultCandidates());
    }

    public static EncodingResolver defaults() {
        return new EncodingResolver(new InspectConfig.EncodingCfg());
    }

    public DecodedText resolve(RawResponse raw) {
        Objects.requireNonNull(raw, "raw");
        final byte[] bytes = raw.getBytes();
        final String url = raw.getSourceUrl();
        final boolean cjkSite = isCjkSite(url);

        try {
            if (raw.hasDeclaredEncoding()) {
                String declared = raw.getDeclaredEncoding();
                try {
                    Charset cs = Charset.forName(declared);
                    return new DecodedText(decodeStrict(bytes, cs), cs.name(), DecodeStage.DECLARED);
                } catch (CharacterCodingException | IllegalArgumentException e) {
                    LOG.debug("Declared charset {} failed for {}: {}", declared, url, e.toString());
                }

                String hint = cjkSite ? GBK : UTF_8;
                try {
                    Charset cs = Charset.forName(hint);
                    String text = decodeStrict(bytes, cs);
                    SLOG.info("decode-fallback", "url", url, "declared", declared, "used", cs.name(), "stage", DecodeStage.SITE_HINT);
                    return new DecodedText(text, cs.name(), DecodeStage.SITE_HINT);
                } catch (CharacterCodingException | IllegalArgumentException e) {
                    LOG.debug("Site-hint charset {} failed for {}: {}", hint, url, e.toString());
                }
            } else {
                DecodedText detected = tryDetected(bytes, url);
                if (detected != null) return detected;
            }
            return fallback(bytes, url, cjkSite);
        } catch (RuntimeException e) {
            // 디코더 구현 내부 오류 등: 체인을 끝까지 못 돌았어도 텍스트는 돌려준다
            SLOG.error("decode-error", e, "url", url);
            return lossy(bytes);
        }
    }

    /** URL이 중국어 사이트 힌트와 맞는지 (대소문자 무시, 부분 문자열) */
    public boolean isCjkSite(String url) {
        if (url == null) return false;
        String lc = url.toLowerCase(Locale.ROOT);
        for (String hint : cjkSiteHints) {
            if (lc.contains(hint)) return true;
        }
        return false;
    }

    /** 후보 인코딩 우선순위 (사이트 힌트 기준) */
    public List<String> candidatesFor(String url) {
        return isCjkSite(url) ? cjkCandidates : defaultCandidates;
    }

    /* ----------------- 단계별 헬퍼 ----------------- */

    private DecodedText tryDetected(byte[] bytes, String url) {
        if (bytes.length == 0) return null;

        byte[] sample = (bytes.length > sampleBytes) ? Arrays.copyOf(bytes, sampleBytes) : bytes;
        CharsetDetector detector = new CharsetDetector();
        detector.enableInputFilter(true); // 태그 노이즈 제외
        detector.setText(sample);
        CharsetMatch match = detector.detect();
        if (match == null) return null;

        double confidence = match.getConfidence() / 100.0;
        if (confidence <= minConfidence) {
            LOG.debug("Low detection confidence for {}: {} ({})", url, match.getName(), confidence);
            return null;
        }
        try {
            Charset cs = Charset.forName(match.getName());
            // 감지 결과는 치환 디코딩: 매핑 불가 바이트는 U+FFFD
            return new DecodedText(new String(bytes, cs), cs.name(), DecodeStage.DETECTED);
        } catch (IllegalArgumentException e) {
            LOG.debug("Detected charset {} not supported by JVM: {}", match.getName(), e.toString());
            return null;
        }
    }

    private DecodedText fallback(byte[] bytes, String url, boolean cjkSite) {
        List<String> candidates = cjkSite ? cjkCandidates : defaultCandidates;
        for (String name : candidates) {
            try {
                Charset cs = Charset.forName(name);
                String text = decodeStrict(bytes, cs);
                SLOG.info("decode-fallback", "url", url, "used", cs.name(), "stage", DecodeStage.FALLBACK);
                return new DecodedText(text, cs.name(), DecodeStage.FALLBACK);
            } catch (CharacterCodingException | IllegalArgumentException e) {
                LOG.debug("Candidate {} failed for {}", name, url);
            }
        }
        SLOG.warn("decode-lossy", "url", url, "bytes", bytes.length);
        return lossy(bytes);
    }

    static String decodeStrict(byte[] bytes, Charset cs) throws CharacterCodingException {
        CharsetDecoder dec = cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return dec.decode(ByteBuffer.wrap(bytes)).toString();
    }

    static DecodedText lossy(byte[] bytes) {
        CharsetDecoder dec = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        String text;
        try {
            text = dec.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // IGNORE 모드에서는 발생하지 않음
            text = new String(bytes, StandardCharsets.UTF_8);
        }
        return new DecodedText(text, StandardCharsets.UTF_8.name(), DecodeStage.LOSSY);
    }

    private static List<String> lower(List<String> in) {
        return in.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }
}
