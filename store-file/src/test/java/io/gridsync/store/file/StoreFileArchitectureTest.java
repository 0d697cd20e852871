package io.gridsync.store.file;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** The file store plugs into the core through its store contract only. */
@AnalyzeClasses(
        packages = "io.gridsync.store.file",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class StoreFileArchitectureTest {

    @ArchTest
    static final ArchRule noControllerOrGridDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.gridsync.core.controller..",
                    "io.gridsync.core.apply..",
                    "io.gridsync.core.extract..",
                    "io.gridsync.core.scheduler..")
            .because("a profile store only persists snapshots");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is not used outside Jackson");
}
