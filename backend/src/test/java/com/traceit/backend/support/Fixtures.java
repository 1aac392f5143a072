package com.traceit.backend.support;

import com.traceit.backend.model.dto.Claim;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.util.List;

public final class Fixtures {

    public static final String LONG_PARAGRAPH = "Researchers at the coastal institute reported on Monday that sea surface "
            + "temperatures in the northern basin rose by 1.2 degrees over the past decade, according to satellite data.";

    private Fixtures() {
    }

    public static ExtractedContent redditPost(String url) {
        return ExtractedContent.builder()
                .platform(SourcePlatform.REDDIT)
                .sourceUrl(url)
                .author("catfan")
                .title("My cat learned to open doors")
                .bodyText("She watched me do it for a week and then just did it.")
                .mediaRefs(List.of("https://i.redd.it/door.jpg"))
                .build();
    }

    public static Claim claim(String id, String text) {
        return Claim.builder()
                .id(id)
                .text(text)
                .embedding(new float[]{0.1f, 0.2f, 0.3f})
                .build();
    }

    /**
     * Article page padded past the markup gate with the given paragraphs in an article element
     */
    public static String articlePage(String title, String... paragraphs) {
        StringBuilder html = new StringBuilder()
                .append("<html><head><title>").append(title).append("</title>")
                .append("<style>").append(".pad{margin:0}".repeat(100)).append("</style>")
                .append("</head><body><nav>Home | World | Science</nav><article>");
        for (String paragraph : paragraphs) {
            html.append("<p>").append(paragraph).append("</p>");
        }
        return html.append("</article><footer>Copyright</footer></body></html>").toString();
    }
}
