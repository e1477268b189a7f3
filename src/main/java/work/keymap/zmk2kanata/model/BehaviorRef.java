package work.keymap.zmk2kanata.model;

import java.util.Objects;

/**
 * What a binding invokes: a behavior declared in the keymap, a built-in, or an explicit placeholder.
 */
public sealed interface BehaviorRef permits BehaviorRef.Resolved, BehaviorRef.Builtin, BehaviorRef.Unknown {
    String name();

    record Resolved(Behavior behavior) implements BehaviorRef {
        public Resolved {
            Objects.requireNonNull(behavior, "behavior");
        }

        @Override
        public String name() {
            return behavior.name();
        }
    }

    record Builtin(BuiltinBehavior builtin) implements BehaviorRef {
        public Builtin {
            Objects.requireNonNull(builtin, "builtin");
        }

        @Override
        public String name() {
            return builtin.zmkName();
        }
    }

    /**
     * Placeholder for a reference that could not be resolved or translated.
     */
    record Unknown(String name, String reason) implements BehaviorRef {
        public Unknown {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
