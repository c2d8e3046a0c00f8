package io.github.nicechester.bibleapi.resolver;

import io.github.nicechester.bibleapi.model.FormatKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One extraction strategy per {@link FormatKind}.
 * Unknown documents fall through USFX, then OSIS by osisID prefix, then generic chapter/verse.
 */
@Component
public class ExtractionStrategies {

    private final Map<FormatKind, ExtractionStrategy> byFormat = new EnumMap<>(FormatKind.class);

    public ExtractionStrategies() {
        UsfxStrategy usfx = new UsfxStrategy();
        OsisContainerStrategy osisContainer = new OsisContainerStrategy();
        GenericChapterVerseStrategy generic = new GenericChapterVerseStrategy();

        register(usfx);
        register(osisContainer);
        register(new OsisMilestoneStrategy());
        register(generic);
        register(new FallbackStrategy(List.of(usfx, osisContainer, generic)));
    }

    private void register(ExtractionStrategy strategy) {
        byFormat.put(strategy.kind(), strategy);
    }

    public ExtractionStrategy forFormat(FormatKind format) {
        return byFormat.get(format);
    }
}
