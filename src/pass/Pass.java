package pass;

import ir.IRModule;

public interface Pass {
    // just a mark class

    public interface IRPass extends Pass {
        IRPassType getType();

        /**
         * Runs the pass over the whole module.
         *
         * @return true if the module was changed
         */
        boolean run(IRModule module);
    }
}
