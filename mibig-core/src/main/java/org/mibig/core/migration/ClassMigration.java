package org.mibig.core.migration;

import org.mibig.core.model.biosynthesis.classes.ClassInfo;
import org.mibig.core.model.module.Module;

import java.util.List;

/**
 * Result of migrating one biosynthetic class: its payload and the modules it contributes.
 *
 * @param info class payload
 * @param modules modules found while migrating the class
 */
public record ClassMigration(ClassInfo info, List<Module> modules) {

    public ClassMigration {
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    public static ClassMigration of(ClassInfo info) {
        return new ClassMigration(info, List.of());
    }
}
