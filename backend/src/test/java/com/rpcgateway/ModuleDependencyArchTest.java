package com.rpcgateway;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: config is the only composition root; node and ratelimit know nothing of the RPC layer.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.rpcgateway");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..node..", "..ratelimit..", "..rpc..", "..config..", "..store..");
        rule.check(classes);
    }

    @Test
    void node_must_not_depend_on_rpc_ratelimit_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..node..")
                .should().dependOnClassesThat().resideInAnyPackage("..rpc..", "..ratelimit..", "..config..", "..store..");
        rule.check(classes);
    }

    @Test
    void ratelimit_must_not_depend_on_rpc_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ratelimit..")
                .should().dependOnClassesThat().resideInAnyPackage("..rpc..", "..config..", "..store..");
        rule.check(classes);
    }

    @Test
    void rpc_must_not_depend_on_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..rpc..")
                .should().dependOnClassesThat().resideInAnyPackage("..config..", "..store..");
        rule.check(classes);
    }

    @Test
    void store_is_independent_of_the_gateway_core() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..store..")
                .should().dependOnClassesThat().resideInAnyPackage("..node..", "..ratelimit..", "..rpc..", "..config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.rpcgateway.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
