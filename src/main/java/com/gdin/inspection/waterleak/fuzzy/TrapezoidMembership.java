package com.gdin.inspection.waterleak.fuzzy;

import com.gdin.inspection.waterleak.config.properties.RiskProperties;

/**
 * 梯形隶属度函数。a == b == -Infinity 为左肩（x <= c 时恒为 1），
 * c == d == +Infinity 为右肩（x >= b 时恒为 1）。
 */
public final class TrapezoidMembership {
    private TrapezoidMembership() {}

    public static double degree(RiskProperties.Trapezoid t, double x) {
        return degree(t.getA(), t.getB(), t.getC(), t.getD(), x);
    }

    public static double degree(double a, double b, double c, double d, double x) {
        if (x < b) {
            if (Double.isInfinite(a)) return 1.0;
            if (x <= a) return 0.0;
            return (x - a) / (b - a);
        }
        if (x <= c) return 1.0;
        if (x < d) return (d - x) / (d - c);
        return 0.0;
    }
}
