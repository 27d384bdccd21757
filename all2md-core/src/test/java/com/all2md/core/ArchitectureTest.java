package com.all2md.core;

import com.all2md.core.ast.Node;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate layering of the document model.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>AST nodes are immutable records</li>
 *   <li>The AST does not know about the layers built on top of it</li>
 *   <li>Parsers and renderers only meet through the AST</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.all2md.core");
    }

    @Test
    void nodes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().implement(Node.class)
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void configTypes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..config..")
            .and().haveSimpleNameEndingWith("Config")
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * The AST is the shared vocabulary; sections, serialization and rendering sit above it.
     */
    @Test
    void ast_shouldNotDependOnHigherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..ast..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..section..", "..serialization..", "..renderer..", "..parser..", "..transform..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..renderer..", "..parser..");

        rule.check(classes);
    }

    @Test
    void parsers_shouldNotDependOnRendererImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser.impl..")
            .should().dependOnClassesThat().resideInAPackage("..renderer.impl..");

        rule.check(classes);
    }
}
