package com.complexityscan.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * ArchUnit tests to validate architectural rules.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Data models are immutable records</li>
 *   <li>Only the parser and analysis layers touch tree-sitter</li>
 *   <li>Lower layers never depend on scheduling or reporting</li>
 *   <li>Packages are free of cycles</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.complexityscan.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .and().areNotEnums()
            .and().areTopLevelClasses()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void treeSitter_shouldOnlyBeUsedByParsingLayers() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackages("..core.parser..", "..core.normalize..", "..core.metrics..",
                "..core.language..")
            .should().dependOnClassesThat().resideInAPackage("org.treesitter..");

        rule.check(classes);
    }

    @Test
    void analysis_shouldNotDependOnScanOrReport() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.model..", "..core.parser..", "..core.normalize..",
                "..core.metrics..", "..core.aggregate..", "..core.discovery..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.scan..", "..core.report..",
                "..core.renderer..");

        rule.check(classes);
    }

    @Test
    void packages_shouldBeFreeOfCycles() {
        slices().matching("com.complexityscan.core.(*)..")
            .should().beFreeOfCycles()
            .check(classes);
    }
}
