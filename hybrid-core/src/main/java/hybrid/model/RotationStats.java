package hybrid.model;

public class RotationStats
{
  private final int                  totalRotations;
  private final long                 averageKeyLifetimeDays;
  private final RotationHistoryEntry oldestRotation;
  private final RotationHistoryEntry newestRotation;
  private final int                  rotationsThisYear;
  private final int                  rotationsThisMonth;

  public RotationStats( int totalRotations, long averageKeyLifetimeDays, RotationHistoryEntry oldestRotation,
                        RotationHistoryEntry newestRotation, int rotationsThisYear, int rotationsThisMonth )
  {
    this.totalRotations         = totalRotations;
    this.averageKeyLifetimeDays = averageKeyLifetimeDays;
    this.oldestRotation         = oldestRotation;
    this.newestRotation         = newestRotation;
    this.rotationsThisYear      = rotationsThisYear;
    this.rotationsThisMonth     = rotationsThisMonth;
  }

  public int                  getTotalRotations()         { return totalRotations;         }
  public long                 getAverageKeyLifetimeDays() { return averageKeyLifetimeDays; }
  public RotationHistoryEntry getOldestRotation()         { return oldestRotation;         }
  public RotationHistoryEntry getNewestRotation()         { return newestRotation;         }
  public int                  getRotationsThisYear()      { return rotationsThisYear;      }
  public int                  getRotationsThisMonth()     { return rotationsThisMonth;     }

  @Override
  public String toString()
  {
    return String.format( "RotationStats{total=%d, avgLifetimeDays=%d, thisYear=%d, thisMonth=%d}", totalRotations, averageKeyLifetimeDays, rotationsThisYear, rotationsThisMonth );
  }
}
