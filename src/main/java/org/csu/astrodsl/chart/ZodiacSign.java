package org.csu.astrodsl.chart;

/**
 * 黄道十二宫，按黄经顺序排列，每个星座占 30 度。
 */
public enum ZodiacSign {
    Aries,
    Taurus,
    Gemini,
    Cancer,
    Leo,
    Virgo,
    Libra,
    Scorpio,
    Sagittarius,
    Capricorn,
    Aquarius,
    Pisces;

    private static final ZodiacSign[] ORDER = values();

    /**
     * @param longitude 黄经 (度)，任意实数，先归一化到 [0, 360)
     */
    public static ZodiacSign fromLongitude(double longitude) {
        int index = (int) Math.floor(ChartDataConverter.normalize(longitude) / 30.0);
        return ORDER[index % 12];
    }

    /**
     * 判断一个标识符是否是星座名 (区分大小写)
     */
    public static boolean isSign(String name) {
        for (ZodiacSign sign : ORDER) {
            if (sign.name().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
