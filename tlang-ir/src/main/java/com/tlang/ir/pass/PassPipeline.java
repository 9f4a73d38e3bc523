package com.tlang.ir.pass;

import com.tlang.ir.IrConfig;
import com.tlang.ir.lowering.LowerAst;
import com.tlang.ir.node.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 编译 Pass 管线，按加入顺序依次执行。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<IrPass> passes = new ArrayList<>();

    /**
     * 默认管线：降级 → 校验（可关闭） → 调度传播 → 类型检查。
     */
    public static PassPipeline createDefault(IrConfig config) {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new LowerAst(config.isMaterializeLoads()));
        if (config.isVerify()) {
            pipeline.addPass(new IrVerifier());
        }
        pipeline.addPass(new PropagateSchedule());
        pipeline.addPass(new TypeCheck());
        return pipeline;
    }

    public void addPass(IrPass pass) {
        passes.add(pass);
    }

    public List<IrPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * 查找指定类型的 pass（取第一个）。
     */
    public <T extends IrPass> T getPass(Class<T> type) {
        for (IrPass pass : passes) {
            if (type.isInstance(pass)) return type.cast(pass);
        }
        return null;
    }

    /**
     * 依次执行所有 pass。
     *
     * @return 是否有 pass 修改了树
     */
    public boolean execute(Block root) {
        boolean modified = false;
        for (IrPass pass : passes) {
            boolean changed = pass.run(root);
            LOG.fine(pass.getName() + (changed ? ": 已修改" : ": 无修改"));
            modified |= changed;
        }
        return modified;
    }
}
