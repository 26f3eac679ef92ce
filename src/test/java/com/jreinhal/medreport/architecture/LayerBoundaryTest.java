package com.jreinhal.medreport.architecture;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Layer boundaries of the report core.
 *
 * Content validation and the workflow table are plain domain code and stay free of Spring and Mongo. Stores
 * sit below the service and never call back into it.
 */
class LayerBoundaryTest {

    private static final JavaClasses CLASSES = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.jreinhal.medreport");

    @Test
    @DisplayName("content model must not depend on Spring or Mongo")
    void contentModelShouldBeFrameworkFree() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..report.content..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("org.springframework..", "com.mongodb..", "org.bson..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("workflow table must not depend on Spring or Mongo")
    void workflowShouldBeFrameworkFree() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..workflow..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("org.springframework..", "com.mongodb..", "org.bson..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("stores must not depend on the service layer")
    void storesShouldNotDependOnServices() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..repository..", "..ledger..")
                .should().dependOnClassesThat()
                .resideInAPackage("..service..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("domain types must not depend on stores or services")
    void domainShouldNotDependOnInfrastructure() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..medreport.report..", "..workflow..", "..exception..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..repository..", "..ledger..", "..service..", "..config..");
        rule.check(CLASSES);
    }

    @Test
    @DisplayName("only the service layer uses the workflow table")
    void onlyServicesUseWorkflow() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..repository..", "..ledger..", "..config..")
                .should().dependOnClassesThat()
                .resideInAPackage("..workflow..");
        rule.check(CLASSES);
    }
}
