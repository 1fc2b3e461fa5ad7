package ir.value;

public enum Opcode {
    // 二元运算指令
    ADD("add"), // 加法
    SUB("sub"), // 减法
    MUL("mul"), // 乘法
    SDIV("sdiv"), // 有符号除法
    UDIV("udiv"), // 无符号除法
    SREM("srem"), // 有符号取余
    UREM("urem"), // 无符号取余
    SHL("shl"), // 左移
    LSHR("lshr"), // 逻辑右移
    ASHR("ashr"), // 算术右移
    AND("and"), // 按位与
    OR("or"), // 按位或
    XOR("xor"), // 按位异或

    FADD("fadd"), // 浮点加法
    FSUB("fsub"), // 浮点减法
    FMUL("fmul"), // 浮点乘法
    FDIV("fdiv"), // 浮点除法
    FREM("frem"), // 浮点取余

    // 比较指令
    ICMP("icmp"),
    FCMP("fcmp"),

    // 类型转换指令
    TRUNC("trunc"), // 截断
    ZEXT("zext"), // 零扩展
    SEXT("sext"), // 符号扩展
    FPTRUNC("fptrunc"),
    FPEXT("fpext"),
    FPTOUI("fptoui"),
    FPTOSI("fptosi"), // 浮点转有符号整数
    UITOFP("uitofp"),
    SITOFP("sitofp"), // 有符号整数转浮点
    PTRTOINT("ptrtoint"), // 指针转整数
    INTTOPTR("inttoptr"), // 整数转指针
    BITCAST("bitcast"), // 位转换

    // 内存操作指令
    ALLOCA("alloca"), // 分配栈空间
    LOAD("load"), // 从内存加载
    STORE("store"), // 存储到内存
    GETELEMENTPTR("getelementptr"), // 获取元素指针

    // 终结指令
    RET("ret"), // 返回
    BR("br"), // 分支
    SWITCH("switch"),
    UNREACHABLE("unreachable"),

    // 其他指令
    PHI("phi"), // Phi 节点
    CALL("call"), // 函数调用
    SELECT("select"), // 三元操作
    ;

    private final String keyword;

    Opcode(String keyword) {
        this.keyword = keyword;
    }

    /* the mnemonic as written in textual IR */
    public String getKeyword() {
        return keyword;
    }

    public static Opcode fromKeyword(String keyword) {
        for (Opcode op : values()) {
            if (op.keyword.equals(keyword)) {
                return op;
            }
        }
        throw new IllegalArgumentException("unknown opcode '" + keyword + "'");
    }

    /**
     * 判断操作码是否为终结指令
     *
     * @return 如果是终结指令返回 true
     */
    public boolean isTerminator() {
        return this == RET || this == BR || this == SWITCH || this == UNREACHABLE;
    }

    public boolean isBinary() {
        return ordinal() >= ADD.ordinal() && ordinal() <= FREM.ordinal();
    }

    public boolean isCast() {
        return ordinal() >= TRUNC.ordinal() && ordinal() <= BITCAST.ordinal();
    }
}
