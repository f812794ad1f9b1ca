package com.idp.assessment.service;

import com.idp.assessment.exception.SchemaMismatchException;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.LeafPath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.idp.assessment.TestFixtures.STATEMENT_EXTRACTION;
import static com.idp.assessment.TestFixtures.STATEMENT_SCHEMA;
import static com.idp.assessment.TestFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for leaf discovery.
 */
class SchemaAnalyzerTest {

    private final SchemaAnalyzer analyzer = new SchemaAnalyzer();
    private final GroupAttribute schema = new SchemaParser().parse(json(STATEMENT_SCHEMA));

    @Test
    void listsLeavesDepthFirstInSchemaOrder() {
        List<LeafPath> leaves = analyzer.analyze(schema, json(STATEMENT_EXTRACTION));

        assertThat(leaves).extracting(LeafPath::toString).containsExactly(
                "AccountNumber", "StatementDate", "CustomerName", "CriticalField",
                "Bank.Name", "Bank.Address.City", "Bank.Address.Zip",
                "Transactions[0].Date", "Transactions[0].Amount", "Transactions[0].Merchant.Name",
                "Transactions[1].Date", "Transactions[1].Amount", "Transactions[1].Merchant.Name");
    }

    @Test
    void missingAndNullContainersArePruned() {
        List<LeafPath> leaves = analyzer.analyze(schema, json("""
                {"AccountNumber": null, "Bank": null, "Transactions": [], "Unknown": 3}"""));

        assertThat(leaves).containsExactly(LeafPath.of("AccountNumber"));
    }

    @Test
    void groupHoldingScalarIsMismatch() {
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> analyzer.analyze(schema, json("{\"Bank\": \"ACME\"}")));

        assertThat(e.getPath()).isEqualTo("Bank");
    }

    @Test
    void simpleAttributeHoldingObjectIsMismatch() {
        assertThrows(SchemaMismatchException.class,
                () -> analyzer.analyze(schema, json("{\"Transactions\": [{\"Date\": {\"day\": 2}}]}")));
    }
}
