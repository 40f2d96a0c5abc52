package com.pagelens.core.analyzer;

import com.pagelens.core.analyzer.analyzers.AccessibilityAnalyzer;
import com.pagelens.core.analyzer.analyzers.ContentAnalyzer;
import com.pagelens.core.analyzer.analyzers.HeadingsAnalyzer;
import com.pagelens.core.analyzer.analyzers.ImagesAnalyzer;
import com.pagelens.core.analyzer.analyzers.LinksAnalyzer;
import com.pagelens.core.analyzer.analyzers.MetaAnalyzer;
import com.pagelens.core.analyzer.analyzers.MobileFriendlyAnalyzer;
import com.pagelens.core.analyzer.analyzers.PerformanceAnalyzer;
import com.pagelens.core.analyzer.analyzers.SchemaAnalyzer;
import com.pagelens.core.analyzer.analyzers.SecurityAnalyzer;
import com.pagelens.core.analyzer.analyzers.SocialMediaAnalyzer;
import com.pagelens.core.analyzer.analyzers.TitleAnalyzer;
import com.pagelens.core.api.IAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 분석기 이름 → 생성자. 전역 싱글턴이 아니라 시작 시 만들어 오케스트레이터에 주입한다.
 * 등록은 시작 단계에서만 하고, 이후 조회는 여러 스레드에서 동시에 해도 된다.
 */
public final class AnalyzerRegistry {

    private final Map<String, Function<AnalyzerConfig, IAnalyzer>> factories = new LinkedHashMap<>();

    /** 기본 분석기 12종이 등록된 레지스트리 */
    public static AnalyzerRegistry defaults() {
        return new AnalyzerRegistry()
                .register(SecurityAnalyzer.NAME, SecurityAnalyzer::new)
                .register(PerformanceAnalyzer.NAME, PerformanceAnalyzer::new)
                .register(SchemaAnalyzer.NAME, SchemaAnalyzer::new)
                .register(AccessibilityAnalyzer.NAME, AccessibilityAnalyzer::new)
                .register(MobileFriendlyAnalyzer.NAME, MobileFriendlyAnalyzer::new)
                .register(SocialMediaAnalyzer.NAME, SocialMediaAnalyzer::new)
                .register(TitleAnalyzer.NAME, TitleAnalyzer::new)
                .register(MetaAnalyzer.NAME, MetaAnalyzer::new)
                .register(HeadingsAnalyzer.NAME, HeadingsAnalyzer::new)
                .register(ImagesAnalyzer.NAME, ImagesAnalyzer::new)
                .register(LinksAnalyzer.NAME, LinksAnalyzer::new)
                .register(ContentAnalyzer.NAME, ContentAnalyzer::new);
    }

    public AnalyzerRegistry register(String name, Function<AnalyzerConfig, IAnalyzer> factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        if (name.isBlank()) throw new IllegalArgumentException("analyzer name must not be blank");
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("analyzer already registered: " + name);
        }
        return this;
    }

    /** 설정을 바인딩한 분석기 인스턴스. 옵션 타입 오류는 여기서 IllegalArgumentException. */
    public IAnalyzer create(String name, AnalyzerConfig config) {
        Function<AnalyzerConfig, IAnalyzer> f = factories.get(name);
        if (f == null) throw new UnknownAnalyzerException(List.of(String.valueOf(name)), names());
        return f.apply(config == null ? AnalyzerConfig.defaults() : config);
    }

    /** 모르는 이름이 하나라도 있으면 전부 모아 UnknownAnalyzerException */
    public void requireKnown(Collection<String> names) {
        List<String> unknown = new ArrayList<>();
        for (String n : names) if (!factories.containsKey(n)) unknown.add(n);
        if (!unknown.isEmpty()) throw new UnknownAnalyzerException(unknown, names());
    }

    public boolean contains(String name) { return factories.containsKey(name); }

    public Set<String> names() { return Collections.unmodifiableSet(factories.keySet()); }
}
