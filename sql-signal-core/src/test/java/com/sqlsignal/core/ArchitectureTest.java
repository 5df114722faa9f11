package com.sqlsignal.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models and IR types are immutable records</li>
 *   <li>The ANTLR runtime stays behind the parser package</li>
 *   <li>Analysis layers do not depend on output layers</li>
 *   <li>Renderers implement the renderer SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.sqlsignal.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..core.model..", "..core.ir..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Generated parser classes and the ANTLR runtime are an implementation detail of the grammar
     * producer; everything downstream sees only the IR.
     */
    @Test
    void antlr_shouldOnlyBeUsedByParser() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackages("com.sqlsignal.core.parser..", "com.sqlsignal.parser..")
            .should().dependOnClassesThat().resideInAnyPackage("org.antlr..", "com.sqlsignal.parser..");

        rule.check(classes);
    }

    @Test
    void analysisLayers_shouldNotDependOnOutput() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.signal..", "..core.flow..", "..core.callgraph..", "..core.parser..", "..core.ir..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.renderer..", "..core.generator..");

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCli() {
        ArchRule rule = noClasses()
            .should().dependOnClassesThat().resideInAPackage("com.sqlsignal.cli..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementOutputRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.sqlsignal.core.renderer.OutputRenderer");

        rule.check(classes);
    }

    /**
     * Diagnostics go through SLF4J; only the console renderer writes to standard output.
     */
    @Test
    void onlyConsoleRenderer_shouldUseSystemOut() {
        ArchRule rule = noClasses()
            .that().doNotHaveSimpleName("ConsoleRenderer")
            .should().accessField(System.class, "out")
            .orShould().accessField(System.class, "err");

        rule.check(classes);
    }
}
