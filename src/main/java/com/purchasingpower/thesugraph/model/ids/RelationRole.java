package com.purchasingpower.thesugraph.model.ids;

/**
 * Relation a mediator node stands for, with the shape of its identifier.
 *
 * <p>{@code owner} is the element being lowered; {@code related} is the other end of the relation
 * (target, entailing thesis, proposition, ...).
 */
public enum RelationRole {
    TARGET {
        @Override
        public String base(String owner, String related) {
            return owner + "_to_" + related;
        }
    },
    ENTAILMENT {
        @Override
        public String base(String owner, String related) {
            return related + "_to_" + owner;
        }
    },
    ETIOLOGY {
        @Override
        public String base(String owner, String related) {
            return related + "_in_etiology_in_" + owner;
        }

        @Override
        public boolean substringCollision() {
            return true;
        }
    },
    ANALOGY {
        @Override
        public String base(String owner, String related) {
            return related + "_analogy_to_" + owner;
        }
    },
    REFERENCE {
        @Override
        public String base(String owner, String related) {
            return related + "_referenced-in_" + owner;
        }
    },
    MATCHING_PROPOSITION {
        @Override
        public String base(String owner, String related) {
            return related + "_to_" + owner;
        }
    },
    MATCHING_SEQUENCE {
        @Override
        public String base(String owner, String related) {
            return owner + "_to_" + related;
        }
    };

    public abstract String base(String owner, String related);

    /**
     * Whether a candidate also collides when it merely occurs inside an emitted id.
     */
    public boolean substringCollision() {
        return false;
    }
}
