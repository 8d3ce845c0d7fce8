package com.modelsync.core.server.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Context menu entry. Entries with children are submenus and carry no action.
 *
 * @param id entry ID
 * @param label display label
 * @param action host action to run, null for submenus
 * @param args action arguments
 * @param children submenu entries
 * @param enabled whether the entry can be chosen
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record MenuItem(
    String id,
    String label,
    String action,
    Map<String, String> args,
    List<MenuItem> children,
    boolean enabled
) {
    public MenuItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        args = args != null ? Map.copyOf(args) : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static MenuItem action(String id, String label, String action, Map<String, String> args) {
        return new MenuItem(id, label, action, args, List.of(), true);
    }

    public static MenuItem submenu(String id, String label, List<MenuItem> children) {
        return new MenuItem(id, label, null, Map.of(), children, !children.isEmpty());
    }

    public MenuItem withEnabled(boolean isEnabled) {
        return new MenuItem(id, label, action, args, children, isEnabled);
    }

    public boolean isSubmenu() {
        return !children.isEmpty();
    }
}
