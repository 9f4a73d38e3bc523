package com.tlang.ir;

/**
 * 编译配置，在创建编译器时确定。
 * <p>
 * materializeLoads 与 verify 只在 {@link com.tlang.ir.pass.PassPipeline#createDefault} 构建管线时读取一次，
 * 之后再修改不会影响已创建的编译器；dumpIr 与 dumpOnFault 在每次编译时读取。
 */
public class IrConfig {

    /** 局部变量引用降级为显式 load */
    private boolean materializeLoads = false;
    /** 降级后校验 SSA 不变量 */
    private boolean verify = true;
    /** 编译完成后把 IR 写入日志 */
    private boolean dumpIr = false;
    /** pass 出错时先把当前 IR 写入日志再抛出 */
    private boolean dumpOnFault = false;

    /**
     * 从环境变量读取：TLANG_DUMP_IR=1、TLANG_DUMP_ON_FAULT=1。
     */
    public static IrConfig fromEnvironment() {
        IrConfig config = new IrConfig();
        config.setDumpIr("1".equals(System.getenv("TLANG_DUMP_IR")));
        config.setDumpOnFault("1".equals(System.getenv("TLANG_DUMP_ON_FAULT")));
        return config;
    }

    public boolean isMaterializeLoads() { return materializeLoads; }
    /** 仅对之后创建的管线生效 */
    public void setMaterializeLoads(boolean materializeLoads) { this.materializeLoads = materializeLoads; }

    public boolean isVerify() { return verify; }
    /** 仅对之后创建的管线生效 */
    public void setVerify(boolean verify) { this.verify = verify; }

    public boolean isDumpIr() { return dumpIr; }
    public void setDumpIr(boolean dumpIr) { this.dumpIr = dumpIr; }

    public boolean isDumpOnFault() { return dumpOnFault; }
    public void setDumpOnFault(boolean dumpOnFault) { this.dumpOnFault = dumpOnFault; }
}
