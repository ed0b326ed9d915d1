package com.doctex.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the package layering of the rendering engine.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records or enums with no engine dependencies</li>
 *   <li>Configuration does not know about the engine</li>
 *   <li>Rewrite passes and the assembler stay independent of the dispatch renderer</li>
 *   <li>Output renderers only see rendered documents</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.doctex.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..config..", "..format..", "..rewrite..", "..reference..", "..table..",
                "..renderer..", "..assembler..", "..output..");

        rule.check(classes);
    }

    @Test
    void config_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..model..", "..rewrite..", "..reference..", "..table..", "..renderer..", "..assembler..");

        rule.check(classes);
    }

    /**
     * Rewrite passes run before dispatch and must not reach into it.
     */
    @Test
    void rewrite_shouldNotDependOnRenderer() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..rewrite..")
            .should().dependOnClassesThat().resideInAnyPackage("..renderer..", "..assembler..");

        rule.check(classes);
    }

    @Test
    void assembler_shouldNotDependOnRenderer() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..assembler..")
            .should().dependOnClassesThat().resideInAnyPackage("..renderer..", "..table..", "..reference..");

        rule.check(classes);
    }

    @Test
    void table_shouldNotDependOnRenderer() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..table..", "..reference..", "..format..")
            .should().dependOnClassesThat().resideInAPackage("..renderer..");

        rule.check(classes);
    }

    @Test
    void output_shouldOnlySeeRenderedDocuments() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..output..")
            .should().dependOnClassesThat().resideInAnyPackage("..renderer..", "..assembler..", "..rewrite..");

        rule.check(classes);
    }
}
