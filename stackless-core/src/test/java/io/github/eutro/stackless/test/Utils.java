package io.github.eutro.stackless.test;

import io.github.eutro.stackless.bytecode.AttrId;
import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.env.*;
import io.github.eutro.stackless.target.FunctionTarget;
import io.github.eutro.stackless.target.FunctionTargetData;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Utils {
    private int nextAttr = 0;

    public final GlobalEnv env = new GlobalEnv();
    public final ModuleEnv module = env.addModule("Test");
    public final StructEnv resource = module.addStruct("R", true);

    public AttrId attr() {
        return new AttrId(nextAttr++);
    }

    public Type resourceType() {
        return Type.struct(module.getId(), resource.getId());
    }

    /**
     * {@code fun Test::add(a: u64, b: bool): u64}, with no declared locals.
     */
    public FunctionEnv add() {
        return module.newFunction("add")
                .addParameter("a", Type.U64)
                .addParameter("b", Type.BOOL)
                .addReturn(Type.U64)
                .build();
    }

    public static FunctionTargetData initial(FunctionEnv fun, Bytecode... code) {
        return FunctionTargetData.initial(fun, Arrays.asList(code), Collections.emptyMap(), Collections.emptyMap());
    }

    public static FunctionTarget target(FunctionEnv fun, List<Bytecode> code) {
        return new FunctionTarget(fun, FunctionTargetData.initial(
                fun, code, Collections.emptyMap(), Collections.emptyMap()));
    }
}
