package com.chicu.marketpulse.market.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Candle {

    /** epoch millis начала свечи */
    private long time;
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;

    // аксессоры в "record-стиле": c.time(), c.close() и т.д.
    public long time()     { return time; }
    public double open()   { return open; }
    public double high()   { return high; }
    public double low()    { return low; }
    public double close()  { return close; }
    public double volume() { return volume; }
}
