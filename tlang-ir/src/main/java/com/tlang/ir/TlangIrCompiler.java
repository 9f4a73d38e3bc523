package com.tlang.ir;

import com.tlang.ir.node.Block;
import com.tlang.ir.node.Stmt;
import com.tlang.ir.pass.PassPipeline;
import com.tlang.ir.print.IrPrinter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * IR 编译门面。
 * 管线：前端构建的树 → 降级到 SSA → 校验 → 调度传播 → 类型检查。
 */
public class TlangIrCompiler {

    private static final Logger LOG = Logger.getLogger(TlangIrCompiler.class.getName());

    private final IrConfig config;
    private final PassPipeline pipeline;

    public TlangIrCompiler() {
        this(IrConfig.fromEnvironment());
    }

    public TlangIrCompiler(IrConfig config) {
        this(config, PassPipeline.createDefault(config));
    }

    public TlangIrCompiler(IrConfig config, PassPipeline pipeline) {
        this.config = config;
        this.pipeline = pipeline;
    }

    public IrConfig getConfig() {
        return config;
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 原地编译以 root 为根的树。
     *
     * @return 同一个 root，已降级
     */
    public Block compile(Block root) {
        try {
            pipeline.execute(root);
        } catch (RuntimeException e) {
            if (config.isDumpOnFault()) {
                LOG.log(Level.SEVERE, "编译失败，当前 IR:\n" + dump(root), e);
            }
            throw e;
        }
        if (config.isDumpIr()) {
            LOG.info("===== IR DUMP =====\n" + dump(root) + "===== END IR DUMP =====");
        }
        return root;
    }

    /**
     * IR 的文本形式。
     */
    public String dump(Stmt node) {
        return IrPrinter.print(node);
    }
}
