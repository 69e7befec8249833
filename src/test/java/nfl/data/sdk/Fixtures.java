package nfl.data.sdk;

import java.util.Arrays;
import java.util.List;

final class Fixtures {

    private Fixtures() {
    }

    static final String WEEKLY_2022_CSV = """
            player_id,player_name,position,season,week,passing_yards,passing_epa
            00-0033873,P.Mahomes,QB,2022,1,360,12.5
            00-0034796,L.Jackson,QB,2022,1,213,NA
            00-0036389,J.Hurts,QB,2022,2,333,8.25
            """;

    static final String WEEKLY_2023_CSV = """
            player_id,player_name,position,season,week,passing_yards,passing_epa,fantasy_points
            00-0033873,P.Mahomes,QB,2023,1,226,-1.5,14.04
            00-0035228,K.Murray,WR,2023,1,,,
            """;

    static final String DRAFT_CSV = """
            season,round,pick,team,pfr_player_name,position,hof
            2019,1,1,ARI,Kyler Murray,QB,FALSE
            2020,1,1,CIN,Joe Burrow,QB,FALSE
            2020,1,2,WAS,Chase Young,DE,FALSE
            2021,1,1,JAX,Trevor Lawrence,QB,FALSE
            """;

    static final String PBP_2023_CSV = """
            play_id,game_id,season,posteam,yards_gained,touchdown
            1,2023_01_DET_KC,2023,DET,5,0
            2,2023_01_DET_KC,2023,KC,75,1
            """;

    static final String RAGGED_CSV = """
            season,week,player_name
            2023,1,A.Player
            2023,2
            """;

    static Dataset smallDataset() {
        return new Dataset(
                List.of(new Dataset.Column("season", ColumnType.LONG),
                        new Dataset.Column("player_name", ColumnType.STRING),
                        new Dataset.Column("passing_epa", ColumnType.DOUBLE),
                        new Dataset.Column("starter", ColumnType.BOOLEAN)),
                List.of(Arrays.asList(2023, "P.Mahomes", 12.5, true),
                        Arrays.asList(2023L, "L.Jackson", null, false),
                        Arrays.asList(null, null, Double.NaN, null)));
    }

    static Dataset otherDataset() {
        return new Dataset(
                List.of(new Dataset.Column("season", ColumnType.LONG),
                        new Dataset.Column("round", ColumnType.LONG)),
                List.of(List.of(2020L, 1L), List.of(2020L, 2L)));
    }
}
