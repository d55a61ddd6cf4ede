package org.astbridge.solver.z3;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理符号变量名到 Z3 位向量常量的映射。
 * 确保每个变量名在同一个 Z3 Context 中只有一个对应的 Z3 常量，且位宽一致。
 */
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    @Getter
    private final Context ctx;

    // 按变量名缓存，实例与所属的 Context 一起单线程使用
    private final Map<String, BitVecExpr> bitVecVars;

    /**
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.bitVecVars = new HashMap<>();
    }

    /**
     * 获取指定变量名对应的 Z3 位向量常量。
     * 如果尚未创建，则会创建并缓存。
     * @param name 变量名。
     * @param size 位宽。
     * @return 对应的 Z3 BitVecExpr。
     * @throws IllegalArgumentException 如果同名变量已以不同位宽创建。
     */
    public BitVecExpr getZ3Var(String name, int size) {
        Objects.requireNonNull(name, "Variable name cannot be null.");
        BitVecExpr var = bitVecVars.computeIfAbsent(name, n -> {
            logger.info("创建 Z3 位向量变量: {} ({} 位)", n, size);
            return ctx.mkBVConst(n, size);
        });
        if (var.getSortSize() != size) {
            logger.error("变量 {} 已以 {} 位创建，请求的位宽为 {}", name, var.getSortSize(), size);
            throw new IllegalArgumentException("变量 " + name + " 的位宽不一致: " + var.getSortSize() + " != " + size);
        }
        return var;
    }

    public Map<String, BitVecExpr> getVariables() {
        return Collections.unmodifiableMap(bitVecVars);
    }
}
