package org.csu.astrodsl.chart;

/**
 * 星历计算得到的一颗行星的位置。
 *
 * @param longitude  黄经 (度)
 * @param speed      每日运行速度 (度/日)，负值表示逆行
 * @param retrograde 是否逆行
 */
public record PlanetPosition(double longitude, double speed, boolean retrograde) {

    public static PlanetPosition at(double longitude) {
        return new PlanetPosition(longitude, 0.0, false);
    }
}
