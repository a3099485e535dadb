package com.mchart.chart;

public final class ChartPageFixtures {

    public static final String HOT_100_PAGE =
        """
            <html>
            <head>
            <meta name="description" content="The week's most popular songs"/>
            </head>
            <body>
            <p>Week of January 21, 2026</p>
            <ul class="o-chart-results-list-row">
                <span class="c-label">1</span>
                <h3 class="c-title">Song A</h3>
                <a href="/music/artist/123"><span class="c-label">Artist X</span></a>
                <img src="https://example.com/img1.jpg"/>
                <span>2 weeks</span>
                <span>LW: 3</span>
                <span>Peak: 1</span>
            </ul>
            <ul class="o-chart-results-list-row">
                <span class="c-label">2</span>
                <h3 class="c-title">Song B</h3>
                <a href="/music/artist/456"><span class="c-label">Artist Y</span></a>
                <img src="https://example.com/img2.jpg"/>
                <span>5 weeks</span>
                <span>LW: 1</span>
                <span>Peak: 1</span>
            </ul>
            </body>
            </html>
            """;

    public static final String BILLBOARD_200_PAGE =
        """
            <html>
            <head>
            <meta name="description" content="The week's most popular albums"/>
            </head>
            <body>
            <p>Week of January 21, 2026</p>
            <ul class="o-chart-results-list-row">
                <span class="c-label">1</span>
                <h3 class="c-title">Test Album</h3>
                <a href="/music/artist/789"><span class="c-label">Album Artist</span></a>
                <img src="https://example.com/album.jpg"/>
                <span>10 weeks</span>
            </ul>
            </body>
            </html>
            """;

    public static final String EMPTY_PAGE = "<html><body><p>Chart temporarily unavailable</p></body></html>";

    private ChartPageFixtures() {}
}
