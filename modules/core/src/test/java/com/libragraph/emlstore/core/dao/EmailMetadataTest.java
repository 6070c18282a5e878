package com.libragraph.emlstore.core.dao;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EmailMetadataTest {

    @Test
    void absentValuesNormalise() {
        EmailMetadata meta = new EmailMetadata(null, null, null, null, null, -5, false, null);

        assertThat(meta).isEqualTo(EmailMetadata.empty());
        assertThat(meta.emailDate()).isZero();
    }

    @Test
    void longPreviewIsCut() {
        EmailMetadata meta = EmailMetadata.builder()
                .bodyPreview("x".repeat(EmailMetadata.MAX_PREVIEW_LENGTH + 20))
                .build();

        assertThat(meta.bodyPreview()).hasSize(EmailMetadata.MAX_PREVIEW_LENGTH);
    }

    @Test
    void previewCutNeverSplitsSurrogatePair() {
        String preview = "a".repeat(EmailMetadata.MAX_PREVIEW_LENGTH - 1) + "📧 see attached";

        String cut = EmailMetadata.builder().bodyPreview(preview).build().bodyPreview();

        assertThat(cut).hasSize(EmailMetadata.MAX_PREVIEW_LENGTH - 1);
        assertThat(Character.isHighSurrogate(cut.charAt(cut.length() - 1))).isFalse();
    }

    @Test
    void emojiEndingExactlyAtLimitIsKept() {
        String preview = "a".repeat(EmailMetadata.MAX_PREVIEW_LENGTH - 2) + "📧" + "tail";

        String cut = EmailMetadata.builder().bodyPreview(preview).build().bodyPreview();

        assertThat(cut).hasSize(EmailMetadata.MAX_PREVIEW_LENGTH).endsWith("📧");
    }
}
