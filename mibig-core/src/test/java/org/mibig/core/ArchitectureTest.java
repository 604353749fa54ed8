package org.mibig.core;

import com.tngtech.archunit.core.domain.JavaClass;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchCondition;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.ConditionEvents;
import com.tngtech.archunit.lang.SimpleConditionEvent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests for package layering.
 *
 * <p>The schema model knows nothing about the v3 format or how entries are migrated;
 * the v3 readers know nothing about the current schema.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("org.mibig.core");
    }

    @Test
    void model_shouldNotDependOnMigrationLegacyOrConfig() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("org.mibig.core.model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("org.mibig.core.migration..", "org.mibig.core.legacy..", "org.mibig.core.config..");

        rule.check(classes);
    }

    /**
     * Entities are immutable records; closed vocabularies are enums; variant payloads share
     * an interface.
     */
    @Test
    void model_shouldHoldRecordsEnumsAndInterfacesOnly() {
        ArchRule rule = classes()
            .that().resideInAPackage("org.mibig.core.model..")
            .and().areTopLevelClasses()
            .should(beRecordEnumOrInterface());

        rule.check(classes);
    }

    @Test
    void legacy_shouldNotDependOnModelOrMigration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("org.mibig.core.legacy..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("org.mibig.core.model..", "org.mibig.core.migration..");

        rule.check(classes);
    }

    @Test
    void validation_shouldNotDependOnMigration() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("org.mibig.core.validation..", "org.mibig.core.sequence..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("org.mibig.core.migration..", "org.mibig.core.legacy..");

        rule.check(classes);
    }

    @Test
    void exceptions_shouldExtendMibigException() {
        ArchRule rule = classes()
            .that().resideInAPackage("org.mibig.core.error..")
            .and().haveSimpleNameEndingWith("Exception")
            .and().doNotHaveSimpleName("MibigException")
            .should().beAssignableTo("org.mibig.core.error.MibigException");

        rule.check(classes);
    }

    @Test
    void migrators_shouldResideInMigrationPackage() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Migrator")
            .should().resideInAPackage("org.mibig.core.migration");

        rule.check(classes);
    }

    private static ArchCondition<JavaClass> beRecordEnumOrInterface() {
        return new ArchCondition<>("be a record, an enum or an interface") {
            @Override
            public void check(JavaClass javaClass, ConditionEvents events) {
                boolean satisfied = javaClass.isEnum() || javaClass.isInterface() || javaClass.reflect().isRecord();
                events.add(new SimpleConditionEvent(javaClass, satisfied,
                    javaClass.getName() + " is not a record, enum or interface"));
            }
        };
    }
}
