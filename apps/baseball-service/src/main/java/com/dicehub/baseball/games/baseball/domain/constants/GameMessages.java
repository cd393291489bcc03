package com.dicehub.baseball.games.baseball.domain.constants;

/**
 * 骰子棒球相关的提示消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 会话查找 / 权限 ==========

    public static final String SESSION_NOT_FOUND = "对局不存在";

    public static final String JOIN_CODE_NOT_FOUND = "邀请码无效或对局已开始";

    public static final String NOT_A_PARTICIPANT = "你不是该对局的参与者";

    // ========== 创建 / 加入 ==========

    public static final String ALREADY_IN_SESSION = "你已有进行中或等待中的对局";

    public static final String ROSTER_NOT_OWNED = "该阵容不属于你";

    public static final String ROSTER_INCOMPLETE = "阵容不完整";

    public static final String ROSTER_NOT_FOUND = "阵容不存在";

    public static final String SELF_JOIN = "不能加入自己创建的对局";

    public static final String SESSION_NOT_WAITING = "对局已开始或已结束，无法加入";

    public static final String SEED_REQUIRED = "确定性模拟模式必须提供种子";

    // ========== 走子 ==========

    public static final String SESSION_NOT_ACTIVE = "对局未在进行中";

    /** 未轮到该方（需要格式化，传入当前应行动的一方） */
    public static final String NOT_YOUR_TURN = "未轮到你掷骰（当前应为 %s）";

    public static String formatNotYourTurn(String seat) {
        return String.format(NOT_YOUR_TURN, seat);
    }

    public static final String GAME_ALREADY_OVER = "比赛已结束";

    public static final String INVALID_DICE = "骰子点数必须为两个 1-6 的整数";

    // ========== 认输 / 取消 / 结束 ==========

    public static final String CANCEL_ONLY_WAITING = "只能取消等待中的对局";

    public static final String CANCEL_ONLY_CREATOR = "只有创建者可以取消对局";

    public static final String WINNER_NOT_PARTICIPANT = "胜者必须是对局参与者";

    /** 非法状态迁移（需要格式化） */
    public static final String ILLEGAL_TRANSITION = "对局状态不能从 %s 变为 %s";

    public static String formatIllegalTransition(Object from, Object to) {
        return String.format(ILLEGAL_TRANSITION, from, to);
    }

    // ========== 基础设施 ==========

    public static final String ROSTER_SERVICE_UNAVAILABLE = "阵容服务暂时不可用";

    public static final String STORE_UNAVAILABLE = "对局存储暂时不可用";

    public static final String JOIN_CODE_EXHAUSTED = "无法生成唯一邀请码，请重试";

    /** 未预期异常对外统一提示 */
    public static final String INTERNAL_ERROR = "服务器内部错误，请稍后再试";

    // ========== 请求参数 ==========

    public static final String SESSION_ID_REQUIRED = "sessionId 不能为空";
}
