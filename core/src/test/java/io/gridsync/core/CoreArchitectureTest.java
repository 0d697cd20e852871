package io.gridsync.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import io.gridsync.core.error.GridSyncException;

/**
 * Layering of the core module: value types at the bottom, the controller on top, and nothing
 * below the controller reaching back up.
 */
@AnalyzeClasses(
        packages = "io.gridsync.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule modelIsSelfContained = noClasses()
            .that()
            .resideInAPackage("io.gridsync.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.gridsync.core.schema..",
                    "io.gridsync.core.normalize..",
                    "io.gridsync.core.apply..",
                    "io.gridsync.core.extract..",
                    "io.gridsync.core.store..",
                    "io.gridsync.core.controller..")
            .because("snapshots and option values are plain data");

    @ArchTest
    static final ArchRule schemaAndNormalizerNeverTouchTheGrid = noClasses()
            .that()
            .resideInAnyPackage("io.gridsync.core.schema..", "io.gridsync.core.normalize..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.gridsync.core.spi..", "io.gridsync.core.scheduler..")
            .because("normalization is a pure function of its input");

    @ArchTest
    static final ArchRule onlyTheControllerUsesTheController = noClasses()
            .that()
            .resideOutsideOfPackage("io.gridsync.core.controller..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.gridsync.core.controller..")
            .because("the controller sits on top of every other package");

    @ArchTest
    static final ArchRule spiDependsOnlyOnModel = noClasses()
            .that()
            .resideInAPackage("io.gridsync.core.spi..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.gridsync.core.schema..",
                    "io.gridsync.core.normalize..",
                    "io.gridsync.core.apply..",
                    "io.gridsync.core.extract..",
                    "io.gridsync.core.store..",
                    "io.gridsync.core.scheduler..",
                    "io.gridsync.core.controller..")
            .because("hosts implement the SPI against plain data types");

    @ArchTest
    static final ArchRule extractionDoesNotApply = noClasses()
            .that()
            .resideInAPackage("io.gridsync.core.extract..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.gridsync.core.apply..", "io.gridsync.core.scheduler..")
            .because("saving a profile only reads the grid");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is not used outside Jackson");

    @ArchTest
    static final ArchRule exceptionsExtendTheBase = classes()
            .that()
            .resideInAPackage("io.gridsync.core.error..")
            .and()
            .haveSimpleNameEndingWith("Exception")
            .should()
            .beAssignableTo(GridSyncException.class);
}
