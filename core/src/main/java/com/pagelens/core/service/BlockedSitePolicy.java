package com.pagelens.core.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** 접근이 막혀 있을 수 있는 사이트 목록. 확인 프롬프트 자체는 CLI 몫. */
public final class BlockedSitePolicy {
    private final List<String> sites;

    public BlockedSitePolicy(List<String> sites) {
        this.sites = (sites == null) ? List.of()
                : sites.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    /** URL에 포함된 첫 번째 차단 사이트 조각 */
    public Optional<String> match(String url) {
        if (url == null) return Optional.empty();
        String lc = url.toLowerCase(Locale.ROOT);
        for (String s : sites) {
            if (lc.contains(s)) return Optional.of(s);
        }
        return Optional.empty();
    }

    public List<String> sites() { return sites; }
}
