package com.example.chatfunctions.vision;

import com.example.chatfunctions.error.UpstreamServiceException;
import com.example.chatfunctions.model.Likelihood;
import com.example.chatfunctions.model.ObjectRef;
import com.example.chatfunctions.model.SafeSearchVerdict;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.vision.v1.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * SafeSearch detection through the Cloud Vision API. The image is read by Vision straight from its
 * {@code gs://} URI, nothing is downloaded locally.
 */
@Service
public class CloudVisionImageClassifier implements ImageClassifier {

    private static final Logger logger = LoggerFactory.getLogger(CloudVisionImageClassifier.class);
    private static final String SERVICE = "image-classifier";

    private final ImageAnnotatorClient client;

    public CloudVisionImageClassifier(ImageAnnotatorClient client) {
        this.client = client;
    }

    @Override
    public SafeSearchVerdict classify(ObjectRef image) {
        AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                .setImage(Image.newBuilder()
                        .setSource(ImageSource.newBuilder().setImageUri(image.toGsUri())))
                .addFeatures(Feature.newBuilder().setType(Feature.Type.SAFE_SEARCH_DETECTION))
                .build();

        BatchAnnotateImagesResponse batch;
        try {
            batch = client.batchAnnotateImages(
                    BatchAnnotateImagesRequest.newBuilder().addRequests(request).build());
        } catch (ApiException e) {
            throw new UpstreamServiceException(SERVICE, "SafeSearch request for " + image + " failed", e);
        }
        if (batch.getResponsesCount() == 0) {
            throw new UpstreamServiceException(SERVICE, "empty SafeSearch response for " + image);
        }
        AnnotateImageResponse response = batch.getResponses(0);
        if (response.hasError()) {
            throw new UpstreamServiceException(SERVICE,
                    "SafeSearch error for " + image + ": " + response.getError().getMessage());
        }

        SafeSearchAnnotation annotation = response.getSafeSearchAnnotation();
        logger.debug("SafeSearch for {}: adult={} violence={} racy={}",
                image, annotation.getAdult(), annotation.getViolence(), annotation.getRacy());
        return new SafeSearchVerdict(toLikelihood(annotation.getAdult()), toLikelihood(annotation.getViolence()));
    }

    static Likelihood toLikelihood(com.google.cloud.vision.v1.Likelihood value) {
        switch (value) {
            case VERY_UNLIKELY:
                return Likelihood.VERY_UNLIKELY;
            case UNLIKELY:
                return Likelihood.UNLIKELY;
            case POSSIBLE:
                return Likelihood.POSSIBLE;
            case LIKELY:
                return Likelihood.LIKELY;
            case VERY_LIKELY:
                return Likelihood.VERY_LIKELY;
            default:
                return Likelihood.UNKNOWN;
        }
    }
}
