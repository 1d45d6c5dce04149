package com.example.chatfunctions.service;

import com.example.chatfunctions.blob.BlobStore;
import com.example.chatfunctions.error.MalformedObjectReferenceException;
import com.example.chatfunctions.image.ImageTransform;
import com.example.chatfunctions.model.Likelihood;
import com.example.chatfunctions.model.ObjectRef;
import com.example.chatfunctions.model.SafeSearchVerdict;
import com.example.chatfunctions.model.UploadedObject;
import com.example.chatfunctions.store.DocumentStore;
import com.example.chatfunctions.vision.ImageClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Checks newly uploaded images with SafeSearch and blurs the ones flagged as adult or violent.
 *
 * <p>The moderated flag is set only when an image was blurred; images judged safe leave their
 * message untouched, so {@code moderated=true} means "was blurred", not "was checked".
 *
 * <p>Replacing the image and marking the message are two separate writes. If marking fails after
 * the upload, the blurred image stays in place and the message stays unmarked; the result reports
 * this as a partial commit and nothing is rolled back.
 *
 * <p>The scratch file is named after the object's base name inside a shared scratch directory, so two
 * concurrent invocations for objects with the same base name can overwrite each other's scratch copy.
 */
@Service
public class ModerationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ModerationPipeline.class);

    static final String MODERATED_FIELD = "moderated";

    private final ImageClassifier classifier;
    private final BlobStore blobStore;
    private final ImageTransform imageTransform;
    private final DocumentStore documentStore;
    private final BlurredCopyLedger blurredCopies;

    @Value("${app.moderation.scratch-dir:${java.io.tmpdir}}")
    private Path scratchDir;

    @Value("${app.collections.messages:messages}")
    private String messagesCollection;

    @Value("${app.moderation.threshold:LIKELY}")
    private Likelihood threshold;

    public ModerationPipeline(ImageClassifier classifier, BlobStore blobStore,
                              ImageTransform imageTransform, DocumentStore documentStore,
                              BlurredCopyLedger blurredCopies) {
        this.classifier = classifier;
        this.blobStore = blobStore;
        this.imageTransform = imageTransform;
        this.documentStore = documentStore;
        this.blurredCopies = blurredCopies;
    }

    public ModerationResult handleUpload(UploadedObject object) {
        String path = object.getName();
        if (!object.isImage()) {
            logger.info("Skipping {}: content type {} is not an image", path, object.getContentType());
            return ModerationResult.skipped(path, "Not an image: " + object.getContentType());
        }
        if (blurredCopies.isBlurredCopy(object.toRef(), object.getGeneration())) {
            logger.info("Skipping {}#{}: written by the blur step", path, object.getGeneration());
            return ModerationResult.skipped(path, "Object is our blurred re-upload");
        }

        MessageImagePath imagePath;
        try {
            imagePath = MessageImagePath.decode(path);
        } catch (MalformedObjectReferenceException e) {
            logger.error("Cannot moderate {}: {}", path, e.getMessage());
            return ModerationResult.failed(path, null, null, ModerationResult.Stage.DECODE_PATH, e.getMessage());
        }
        String messageId = imagePath.getMessageId();

        SafeSearchVerdict verdict;
        try {
            verdict = classifier.classify(object.toRef());
        } catch (RuntimeException e) {
            logger.error("Classification of {} failed", path, e);
            return ModerationResult.failed(path, messageId, null, ModerationResult.Stage.CLASSIFY, e.getMessage());
        }

        if (!verdict.isUnsafe(threshold)) {
            logger.info("The image {} has been detected as OK (adult={}, violence={})",
                    path, verdict.getAdult(), verdict.getViolence());
            return ModerationResult.clean(path, messageId, verdict);
        }

        logger.info("The image {} has been detected as inappropriate (adult={}, violence={})",
                path, verdict.getAdult(), verdict.getViolence());
        return blurImage(object, imagePath, verdict);
    }

    private ModerationResult blurImage(UploadedObject object, MessageImagePath imagePath, SafeSearchVerdict verdict) {
        String path = imagePath.getPath();
        String messageId = imagePath.getMessageId();
        ObjectRef ref = object.toRef();
        Path scratchFile = scratchDir.resolve(imagePath.getFileName());

        ModerationResult.Stage stage = ModerationResult.Stage.DOWNLOAD;
        try {
            try {
                blobStore.download(ref, scratchFile);
                logger.debug("Image has been downloaded to {}", scratchFile);

                stage = ModerationResult.Stage.TRANSFORM;
                imageTransform.blur(scratchFile);
                logger.debug("Image {} has been blurred", path);

                stage = ModerationResult.Stage.UPLOAD;
                Long generation = blobStore.upload(scratchFile, ref, object.getContentType(), blurredMetadata(object));
                logger.info("Blurred image has been uploaded to {}", path);
                blurredCopies.record(ref, generation);
            } finally {
                deleteScratch(scratchFile);
            }

            stage = ModerationResult.Stage.MARK_MODERATED;
            documentStore.update(messagesCollection, messageId, Map.of(MODERATED_FIELD, true));
            logger.info("Marked message {} as moderated", messageId);
            return ModerationResult.blurred(path, messageId, verdict);
        } catch (IOException | RuntimeException e) {
            if (stage == ModerationResult.Stage.MARK_MODERATED) {
                logger.error("Blurred image {} was uploaded but message {} could not be marked as moderated",
                        path, messageId, e);
            } else {
                logger.error("Blurring {} failed at {}", path, stage, e);
            }
            return ModerationResult.failed(path, messageId, verdict, stage, e.getMessage());
        }
    }

    /** Keeps the original metadata (download tokens included) and marks the copy as blurred. */
    private static Map<String, String> blurredMetadata(UploadedObject object) {
        Map<String, String> metadata = new HashMap<>();
        if (object.getMetadata() != null) {
            metadata.putAll(object.getMetadata());
        }
        metadata.put(UploadedObject.BLURRED_METADATA_KEY, "true");
        return metadata;
    }

    private void deleteScratch(Path scratchFile) {
        try {
            if (Files.deleteIfExists(scratchFile)) {
                logger.debug("Deleted local file {}", scratchFile);
            }
        } catch (IOException e) {
            logger.warn("Could not delete local file {}", scratchFile, e);
        }
    }
}
