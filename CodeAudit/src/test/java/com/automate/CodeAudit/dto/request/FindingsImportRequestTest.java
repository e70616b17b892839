package com.automate.CodeAudit.dto.request;

import com.automate.CodeAudit.entity.Severity;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FindingsImportRequestTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static List<String> invalidPaths(FindingsImportRequest req) {
        Set<ConstraintViolation<FindingsImportRequest>> violations = validator.validate(req);
        return violations.stream().map(v -> v.getPropertyPath().toString()).toList();
    }

    @Test
    void emptyImportIsValid() {
        assertThat(invalidPaths(new FindingsImportRequest())).isEmpty();
    }

    @Test
    void nullListsAreRejected() {
        FindingsImportRequest req = new FindingsImportRequest();
        req.setVulnerabilities(null);
        req.setVulnerableDependencies(null);

        assertThat(invalidPaths(req)).containsExactlyInAnyOrder("vulnerabilities", "vulnerableDependencies");
    }

    @Test
    void nullNestedListsAreRejected() {
        FindingsImportRequest.Vulnerability vuln = new FindingsImportRequest.Vulnerability();
        vuln.setTitle("SQL injection");
        vuln.setOccurrences(null);
        FindingsImportRequest.VulnerableDependency dep = new FindingsImportRequest.VulnerableDependency();
        dep.setPackageName("django");
        dep.setSeverity(Severity.HIGH);
        dep.setSourceFiles(null);
        FindingsImportRequest req = new FindingsImportRequest();
        req.setVulnerabilities(List.of(vuln));
        req.setVulnerableDependencies(List.of(dep));

        assertThat(invalidPaths(req)).containsExactlyInAnyOrder(
                "vulnerabilities[0].occurrences", "vulnerableDependencies[0].sourceFiles");
    }
}
