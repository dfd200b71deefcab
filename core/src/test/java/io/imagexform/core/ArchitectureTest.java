package io.imagexform.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.Test;

/** Core stays engine-agnostic: no adapter packages and no imaging APIs. */
class ArchitectureTest {

    private static final JavaClasses CORE = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("io.imagexform.core");

    @Test
    void coreDoesNotDependOnAdapters() {
        noClasses()
                .that()
                .resideInAPackage("io.imagexform.core..")
                .should()
                .dependOnClassesThat()
                .resideInAnyPackage("io.imagexform.magick..", "io.imagexform.java2d..", "io.imagexform.standalone..")
                .check(CORE);
    }

    @Test
    void coreDoesNotUseImagingApis() {
        noClasses()
                .that()
                .resideInAPackage("io.imagexform.core..")
                .should()
                .dependOnClassesThat()
                .resideInAnyPackage("java.awt..", "javax.imageio..")
                .check(CORE);
    }

    @Test
    void modelDoesNotDependOnBuilder() {
        noClasses()
                .that()
                .resideInAPackage("io.imagexform.core.model..")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("io.imagexform.core.builder..")
                .check(CORE);
    }
}
