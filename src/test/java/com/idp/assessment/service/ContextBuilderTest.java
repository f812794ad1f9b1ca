package com.idp.assessment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.model.AssessmentContext;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.ContentPart;
import com.idp.assessment.model.DocumentContext;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.PageImage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.idp.assessment.TestFixtures.STATEMENT_EXTRACTION;
import static com.idp.assessment.TestFixtures.STATEMENT_SCHEMA;
import static com.idp.assessment.TestFixtures.json;
import static com.idp.assessment.TestFixtures.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for prompt splitting and rendering.
 */
class ContextBuilderTest {

    private final ContextBuilder contextBuilder = new ContextBuilder(new ObjectMapper());
    private final GroupAttribute schema = new SchemaParser().parse(json(STATEMENT_SCHEMA));
    private final JsonNode extraction = json(STATEMENT_EXTRACTION);
    private final List<AssessmentTask> tasks = new TaskBuilder().build(
            new SchemaAnalyzer().analyze(schema, extraction), schema, extraction, settings());
    private final DocumentContext document = DocumentContext.ofText("BankStatement", "Statement for Jane Doe");

    @Test
    void staticSegmentCarriesDocumentAndFullCatalog() {
        AssessmentContext context = contextBuilder.build(document, schema, settings());

        String text = context.staticSegment().text();
        assertThat(text).startsWith("Class: BankStatement\nStatement for Jane Doe\n");
        assertThat(text).contains("AccountNumber  \t[ Account number ]");
        assertThat(text).contains("Transactions  \t[ Statement lines ]");
        assertThat(text).doesNotContain("{EXTRACTION_RESULTS}").doesNotContain(ContextBuilder.CACHE_POINT);
    }

    /**
     * The dynamic segment only carries the values of the task's own leaves.
     */
    @Test
    void dynamicSegmentCarriesOnlyTaskValues() {
        AssessmentContext context = contextBuilder.build(document, schema, settings());

        String batch = context.dynamicFor(tasks.get(0)).text();
        assertThat(batch).contains("\"AccountNumber\" : \"1234-5678\"");
        assertThat(batch).doesNotContain("CriticalField").doesNotContain("Bank");

        String group = context.dynamicFor(tasks.get(2)).text();
        assertThat(group).contains("\"City\" : \"Springfield\"");
        assertThat(group).doesNotContain("AccountNumber");
    }

    @Test
    void listItemsAreNumberedFromOne() {
        AssessmentContext context = contextBuilder.build(document, schema, settings().withTaskPrompt(
                "{DOCUMENT_TEXT}<<CACHEPOINT>>{ATTRIBUTE_NAMES_AND_DESCRIPTIONS}\n{EXTRACTION_RESULTS}"));

        String second = context.dynamicFor(tasks.get(4)).text();
        assertThat(second).contains("Item #2: {");
        assertThat(second).doesNotContain("Item #1:");
        assertThat(second).contains("Each item: One statement line");
    }

    @Test
    void describeIndentsNestedAttributes() {
        String catalog = ContextBuilder.describe(List.of(schema.child("Bank")));

        assertThat(catalog).isEqualTo("""
                Bank  \t[ Issuing bank ]
                  - Name  \t[ Bank name ]
                  - Address  \t[  ]
                    - City  \t[  ]
                    - Zip  \t[  ]""");
    }

    @Test
    void templateWithoutCachePointIsRejected() {
        assertThrows(ConfigurationException.class, () -> contextBuilder.build(document, schema,
                settings().withTaskPrompt("{DOCUMENT_TEXT} {EXTRACTION_RESULTS}")));
    }

    @Test
    void templateWithTwoCachePointsIsRejected() {
        assertThrows(ConfigurationException.class, () -> contextBuilder.build(document, schema,
                settings().withTaskPrompt("a <<CACHEPOINT>> b <<CACHEPOINT>> {EXTRACTION_RESULTS}")));
    }

    @Test
    void misplacedPlaceholdersAreRejected() {
        assertThrows(ConfigurationException.class, () -> ContextBuilder.validateTemplate(
                "{EXTRACTION_RESULTS} <<CACHEPOINT>> rest"));
        assertThrows(ConfigurationException.class, () -> ContextBuilder.validateTemplate(
                "text <<CACHEPOINT>> {DOCUMENT_IMAGE} {EXTRACTION_RESULTS}"));
        assertThrows(ConfigurationException.class, () -> ContextBuilder.validateTemplate(
                "{DOCUMENT_IMAGE}{DOCUMENT_IMAGE} <<CACHEPOINT>> {EXTRACTION_RESULTS}"));
        assertThrows(ConfigurationException.class, () -> ContextBuilder.validateTemplate("  "));
    }

    @Test
    void imagesAreCappedAtTwenty() {
        List<PageImage> pages = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            pages.add(new PageImage("image/png", new byte[]{(byte) i}));
        }
        DocumentContext withImages = new DocumentContext("doc-1", "1", "BankStatement", "text", "", pages);

        AssessmentContext context = contextBuilder.build(withImages, schema,
                settings().withTaskPrompt("Pages: {DOCUMENT_IMAGE} Text: {DOCUMENT_TEXT}<<CACHEPOINT>>{EXTRACTION_RESULTS}"));

        List<ContentPart> parts = context.staticSegment().parts();
        assertThat(context.staticSegment().images()).hasSize(ContextBuilder.MAX_IMAGES);
        assertThat(parts.get(0)).isEqualTo(new ContentPart.Text("Pages: "));
        assertThat(parts.get(parts.size() - 1)).isEqualTo(new ContentPart.Text(" Text: text"));
    }

    @Test
    void imagesAreNotAttachedWithoutPlaceholder() {
        DocumentContext withImages = new DocumentContext("doc-1", "1", "BankStatement", "text", "",
                List.of(new PageImage("image/png", new byte[]{1})));

        AssessmentContext context = contextBuilder.build(withImages, schema, settings());

        assertThat(context.staticSegment().images()).isEmpty();
    }

    @Test
    void documentTextIsNotScannedForPlaceholders() {
        DocumentContext tricky = DocumentContext.ofText("Invoice", "literal {DOCUMENT_CLASS}");

        AssessmentContext context = contextBuilder.build(tricky, schema, settings());

        assertThat(context.staticSegment().text()).contains("literal {DOCUMENT_CLASS}");
    }

    /**
     * Document placeholders after the cache point are filled per task as well.
     */
    @Test
    void documentPlaceholdersAfterCachePointAreFilled() {
        DocumentContext statement = new DocumentContext("doc-1", "1", "BankStatement", "Statement for Jane Doe",
                "OCR 0.98", List.of());

        AssessmentContext context = contextBuilder.build(statement, schema, settings().withTaskPrompt(
                "Doc {DOCUMENT_TEXT}\n<<CACHEPOINT>>\nAssess these {DOCUMENT_CLASS} fields ({OCR_TEXT_CONFIDENCE}):\n"
                        + "{EXTRACTION_RESULTS}\nSource: {DOCUMENT_TEXT}"));

        String batch = context.dynamicFor(tasks.get(0)).text();
        assertThat(batch).contains("Assess these BankStatement fields (OCR 0.98):");
        assertThat(batch).contains("Source: Statement for Jane Doe");
        assertThat(batch).contains("\"AccountNumber\" : \"1234-5678\"");
        assertThat(batch).doesNotContain("{DOCUMENT_CLASS}").doesNotContain("{DOCUMENT_TEXT}")
                .doesNotContain("{OCR_TEXT_CONFIDENCE}");
    }

    @Test
    void substitutedValuesAreNotScannedAgain() {
        String text = ContextBuilder.substitute("{DOCUMENT_TEXT} / {DOCUMENT_CLASS} / {UNKNOWN}",
                Map.of("{DOCUMENT_TEXT}", "see {DOCUMENT_CLASS} $1", "{DOCUMENT_CLASS}", "Invoice"));

        assertThat(text).isEqualTo("see {DOCUMENT_CLASS} $1 / Invoice / {UNKNOWN}");
    }
}
