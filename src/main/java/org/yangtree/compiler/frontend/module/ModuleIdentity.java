package org.yangtree.compiler.frontend.module;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Name and revision of a module together with the submodules it includes. A set of module
 * identities addresses a compiled schema in the cache.
 *
 * @param name       the module name.
 * @param revision   the newest revision date, or {@code null} if the module declares none.
 * @param submodules the included submodules, sorted by name.
 */
public record ModuleIdentity(String name, String revision, List<ModuleIdentity> submodules) {

    public ModuleIdentity {
        Objects.requireNonNull(name, "name");
        submodules = submodules.stream().sorted(Comparator.comparing(ModuleIdentity::name)).toList();
    }

    public static ModuleIdentity of(String name, String revision) {
        return new ModuleIdentity(name, revision, List.of());
    }
}
