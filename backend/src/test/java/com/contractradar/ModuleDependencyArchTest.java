package com.contractradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Keeps package boundaries: adapters below detection, detection below the stream coordinator, API on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.contractradar");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.contractradar.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.contractradar.common..", "com.contractradar.chain..", "com.contractradar.market..",
                        "com.contractradar.reputation..", "com.contractradar.detection..",
                        "com.contractradar.analysis..", "com.contractradar.ai..", "com.contractradar.api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.contractradar.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.contractradar.domain..", "com.contractradar.chain..", "com.contractradar.market..",
                        "com.contractradar.reputation..", "com.contractradar.detection..",
                        "com.contractradar.analysis..", "com.contractradar.ai..", "com.contractradar.api..");
        rule.check(classes);
    }

    @Test
    void adapters_must_not_depend_on_detection_analysis_ai_api() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.contractradar.chain..", "com.contractradar.market..",
                        "com.contractradar.reputation..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.contractradar.detection..", "com.contractradar.analysis..",
                        "com.contractradar.ai..", "com.contractradar.api..");
        rule.check(classes);
    }

    @Test
    void detection_must_not_depend_on_analysis_ai_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.contractradar.detection..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.contractradar.analysis..", "com.contractradar.ai..", "com.contractradar.api..");
        rule.check(classes);
    }

    @Test
    void only_api_depends_on_api() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("com.contractradar.api..")
                .should().dependOnClassesThat().resideInAPackage("com.contractradar.api..");
        rule.check(classes);
    }
}
