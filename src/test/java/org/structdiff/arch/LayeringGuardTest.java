package org.structdiff.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.structdiff", importOptions = ImportOption.DoNotIncludeTests.class)
class LayeringGuardTest {
    @ArchTest
    static final ArchRule core_does_not_depend_on_outer_layers = noClasses()
            .that()
            .resideInAnyPackage(
                    "org.structdiff.inspect..",
                    "org.structdiff.diff..",
                    "org.structdiff.sink..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.structdiff.obs..",
                    "org.structdiff.report..",
                    "org.structdiff.tool..");

    @ArchTest
    static final ArchRule inspection_does_not_depend_on_diffing = noClasses()
            .that()
            .resideInAPackage("org.structdiff.inspect..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.structdiff.diff..", "org.structdiff.sink..");

    @ArchTest
    static final ArchRule sinks_are_self_contained = noClasses()
            .that()
            .resideInAPackage("org.structdiff.sink..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.structdiff.inspect..", "org.structdiff.diff..");

    @ArchTest
    static final ArchRule library_does_not_depend_on_tool = noClasses()
            .that()
            .resideInAnyPackage("org.structdiff.report..", "org.structdiff.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("org.structdiff.tool..");
}
