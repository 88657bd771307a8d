package com.monopolyhub.monopolyservice.games.monopoly.domain.constants;

/**
 * 大富翁相关的消息常量
 * 统一管理所有用户可见的提示消息（错误提示 + 回合事件描述），避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 错误消息 ==========

    /** 对局不存在 */
    public static final String SESSION_NOT_FOUND = "对局不存在: %s";

    /** 同一对局有其它动作正在执行 */
    public static final String SESSION_BUSY = "对局 %s 正在处理其它操作，请稍后重试";

    /** 对局已结束 */
    public static final String GAME_ALREADY_OVER = "对局已结束，不再接受任何操作";

    /** 玩家不存在 */
    public static final String PLAYER_NOT_FOUND = "玩家不存在: %s";

    /** 玩家已破产 */
    public static final String PLAYER_BANKRUPT = "玩家 %s 已破产";

    /** 未轮到该玩家 */
    public static final String NOT_YOUR_TURN = "还没轮到 %s（当前应为 %s）";

    /** 阶段不允许该操作 */
    public static final String INVALID_PHASE = "当前阶段 %s 不允许执行 %s";

    /** 玩家人数或名字非法 */
    public static final String INVALID_PLAYER_COUNT = "玩家人数必须为 2~8 人";

    /** 玩家名字为空或重复 */
    public static final String INVALID_PLAYER_NAMES = "玩家名字不能为空且不能重复";

    /** 不在狱中 */
    public static final String NOT_IN_JAIL = "玩家 %s 不在狱中";

    /** 狱中只能缴罚金、用出狱卡或掷骰 */
    public static final String IN_JAIL_RESTRICTED = "玩家 %s 在狱中，不允许执行 %s";

    /** 没有出狱卡 */
    public static final String NO_JAIL_CARD = "玩家 %s 没有出狱卡";

    /** 资金不足 */
    public static final String INSUFFICIENT_FUNDS = "%s 资金不足：需要 $%d，现有 $%d";

    /** 不是可持有的格子 */
    public static final String PROPERTY_NOT_OWNABLE = "%s 不是可购买的地产";

    /** 地产已被持有 */
    public static final String PROPERTY_ALREADY_OWNED = "%s 已被 %s 持有";

    /** 玩家不在该地产上 */
    public static final String NOT_ON_PROPERTY = "%s 当前不在 %s 上";

    /** 不是该地产的持有人 */
    public static final String NOT_PROPERTY_OWNER = "%s 不是 %s 的持有人";

    /** 建房规则 */
    public static final String NOT_BUILDABLE = "%s 不能建房（只有普通地产可以）";
    public static final String MONOPOLY_REQUIRED = "建房需要持有 %s 颜色组的全部地产";
    public static final String GROUP_MORTGAGED = "%s 颜色组存在已抵押地产，不能建房";
    public static final String MAX_BUILDINGS = "%s 已经有旅馆";
    public static final String NO_BUILDINGS = "%s 上没有建筑";
    public static final String UNEVEN_BUILD = "必须均匀建房：%s 已比同组其它地产多";
    public static final String UNEVEN_SELL = "必须均匀拆房：%s 少于同组其它地产";
    public static final String HOUSE_POOL_EMPTY = "房屋已全部售出（剩余 %d）";
    public static final String HOTEL_POOL_EMPTY = "旅馆已全部售出";
    public static final String GROUP_HAS_BUILDINGS = "%s 颜色组仍有建筑，需先拆除";

    /** 抵押规则 */
    public static final String ALREADY_MORTGAGED = "%s 已经抵押";
    public static final String NOT_MORTGAGED = "%s 未被抵押";

    /** 交易 */
    public static final String TRADE_NOT_FOUND = "交易不存在: %s";
    public static final String TRADE_PENDING = "已有待处理的交易 %s";
    public static final String TRADE_EMPTY = "交易内容不能为空";
    public static final String TRADE_SELF = "不能与自己交易";
    public static final String TRADE_NEGATIVE = "交易金额/卡数不能为负";
    public static final String TRADE_NOT_PARTY = "%s 不是交易 %s 的当事人";
    public static final String TRADE_NOT_COUNTERPARTY = "只有 %s 可以接受交易 %s";

    // ========== 回合事件 ==========

    public static final String EVENT_ROLLED = "%s 掷出 %d + %d = %d";
    public static final String EVENT_MOVED = "%s 移动到 %d: %s";
    public static final String EVENT_PASSED_GO = "%s 经过起点，获得 $%d";
    public static final String EVENT_OFFER = "%s 无人持有，可以 $%d 购买";
    public static final String EVENT_UTILITY_DICE = "%s 为公用事业租金重新掷骰 %d + %d = %d，租金 ×10";
    public static final String EVENT_PAID_RENT = "%s 向 %s 支付租金 $%d";
    public static final String EVENT_PAID_BANK = "%s 向银行支付 $%d";
    public static final String EVENT_COLLECTED = "%s 从银行获得 $%d";
    public static final String EVENT_CARD = "%s 抽到%s: %s";
    public static final String EVENT_JAIL_CARD_KEPT = "%s 保留出狱卡";
    public static final String EVENT_SENT_TO_JAIL = "%s 入狱";
    public static final String EVENT_SPEEDING = "%s 连续 %d 次对子，超速入狱";
    public static final String EVENT_JAIL_DOUBLES = "%s 掷出对子，出狱";
    public static final String EVENT_JAIL_STAY = "%s 未掷出对子，继续服刑（第 %d 次）";
    public static final String EVENT_JAIL_FORCED_FINE = "%s 第 %d 次未掷出对子，强制缴纳罚金 $%d";
    public static final String EVENT_JAIL_PAID = "%s 缴纳罚金 $%d 出狱";
    public static final String EVENT_JAIL_CARD_USED = "%s 使用出狱卡出狱";
    public static final String EVENT_EXTRA_ROLL = "%s 掷出对子，可以再掷一次";
    public static final String EVENT_BANKRUPT_TO_PLAYER = "%s 破产，全部资产转给 %s";
    public static final String EVENT_BANKRUPT_TO_BANK = "%s 破产，全部地产收归银行";
    public static final String EVENT_GAME_OVER = "游戏结束，胜者: %s";
    public static final String EVENT_TURN_PASSED = "轮到 %s";

    public static String format(String template, Object... args) {
        return String.format(template, args);
    }
}
