package com.bridgerelay;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common and domain are leaves, the relay core talks to chains only through
 * {@code ChainClient}, and only config wires concrete adapters.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.bridgerelay");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..relay..", "org.springframework..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..relay..");
        rule.check(classes);
    }

    @Test
    void relay_core_must_not_depend_on_evm_adapter() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..relay.job..", "..relay.scan..", "..relay.action..", "..relay.checkpoint..")
                .should().dependOnClassesThat().resideInAPackage("..relay.adapter.evm..");
        rule.check(classes);
    }

    @Test
    void relay_core_must_not_depend_on_transport_libraries() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..relay.job..", "..relay.scan..", "..relay.action..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "org.springframework.web..", "reactor..", "io.github.resilience4j..");
        rule.check(classes);
    }

    @Test
    void pipeline_stages_must_not_depend_on_job() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..relay.scan..", "..relay.action..", "..relay.checkpoint..", "..relay.adapter..")
                .should().dependOnClassesThat().resideInAPackage("..relay.job..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.bridgerelay.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
