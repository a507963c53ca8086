package com.rgbregistry;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: api -> registration -> domain; keepalive stands alone.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.rgbregistry");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..registration..", "..api..", "..config..", "..keepalive..");
        rule.check(classes);
    }

    @Test
    void registration_must_not_depend_on_api_or_keepalive() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..registration..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..keepalive..");
        rule.check(classes);
    }

    @Test
    void validation_must_not_touch_the_store() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..registration.validation..")
                .should().dependOnClassesThat().resideInAnyPackage("..registration.store..", "..domain..", "org.springframework.data..");
        rule.check(classes);
    }

    @Test
    void keepalive_must_not_depend_on_registration_domain_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..keepalive..")
                .should().dependOnClassesThat().resideInAnyPackage("..registration..", "..domain..", "..api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.rgbregistry.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
