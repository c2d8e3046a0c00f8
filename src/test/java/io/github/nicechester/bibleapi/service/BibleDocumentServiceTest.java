package io.github.nicechester.bibleapi.service;

import io.github.nicechester.bibleapi.model.FormatKind;
import io.github.nicechester.bibleapi.resolver.FormatDetector;
import io.github.nicechester.bibleapi.resolver.ParsedDocument;
import io.github.nicechester.bibleapi.resolver.XmlDocumentParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class BibleDocumentServiceTest {

    private static final String USFX = "<usfx><book id=\"GEN\"><c id=\"1\"/><v id=\"1\"/>x</book></usfx>";

    private final InMemoryDocumentSource source = new InMemoryDocumentSource()
        .with("gen.xml", USFX)
        .with("missing.xml", null)
        .with("broken.xml", "<usfx><book>");

    private final BibleDocumentService service =
        new BibleDocumentService(source, new XmlDocumentParser(new FormatDetector()), 0);

    @Test
    void parsesDocumentOnce() {
        Optional<ParsedDocument> first = service.document("gen.xml");
        Optional<ParsedDocument> second = service.document("gen.xml");

        assertThat(first).isPresent();
        assertThat(first.get().format()).isEqualTo(FormatKind.USFX);
        assertThat(second.get()).isSameAs(first.get());
        assertThat(source.reads("gen.xml")).isEqualTo(1);
    }

    @Test
    void concurrentFirstAccessReadsOnce() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Optional<ParsedDocument>>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> service.document("gen.xml"));
            }
            for (Future<Optional<ParsedDocument>> result : executor.invokeAll(tasks)) {
                assertThat(result.get()).isPresent();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(source.reads("gen.xml")).isEqualTo(1);
    }

    @Test
    void unreadableDocumentIsRetried() {
        assertThat(service.document("missing.xml")).isEmpty();
        assertThat(service.document("missing.xml")).isEmpty();

        assertThat(source.reads("missing.xml")).isEqualTo(2);
    }

    @Test
    void malformedDocumentIsCachedAsMalformed() {
        assertThat(service.document("broken.xml")).hasValueSatisfying(doc -> assertThat(doc.isMalformed()).isTrue());
        service.document("broken.xml");

        assertThat(source.reads("broken.xml")).isEqualTo(1);
    }

    @Test
    void contentIsCachedSeparately() {
        assertThat(service.content("gen.xml")).isPresent();
        service.document("gen.xml");

        assertThat(source.reads("gen.xml")).isEqualTo(1);
    }
}
