package com.example.chatfunctions.vision;

import com.example.chatfunctions.error.UpstreamServiceException;
import com.example.chatfunctions.model.Likelihood;
import com.example.chatfunctions.model.ObjectRef;
import com.example.chatfunctions.model.SafeSearchVerdict;
import com.google.cloud.vision.v1.*;
import com.google.rpc.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CloudVisionImageClassifierTest {

    @Mock
    private ImageAnnotatorClient client;

    private CloudVisionImageClassifier classifier;

    private final ObjectRef image = new ObjectRef("chat-app.appspot.com", "images/msg123/photo.png");

    @BeforeEach
    void setUp() {
        classifier = new CloudVisionImageClassifier(client);
    }

    private static BatchAnnotateImagesResponse respond(AnnotateImageResponse response) {
        return BatchAnnotateImagesResponse.newBuilder().addResponses(response).build();
    }

    @Test
    void testClassify_RequestsSafeSearchForGsUri() {
        // Given
        when(client.batchAnnotateImages(any(BatchAnnotateImagesRequest.class))).thenReturn(respond(
                AnnotateImageResponse.newBuilder()
                        .setSafeSearchAnnotation(SafeSearchAnnotation.newBuilder()
                                .setAdult(com.google.cloud.vision.v1.Likelihood.LIKELY)
                                .setViolence(com.google.cloud.vision.v1.Likelihood.UNLIKELY))
                        .build()));

        // When
        SafeSearchVerdict verdict = classifier.classify(image);

        // Then
        assertEquals(Likelihood.LIKELY, verdict.getAdult());
        assertEquals(Likelihood.UNLIKELY, verdict.getViolence());

        ArgumentCaptor<BatchAnnotateImagesRequest> captor = ArgumentCaptor.forClass(BatchAnnotateImagesRequest.class);
        verify(client).batchAnnotateImages(captor.capture());
        AnnotateImageRequest request = captor.getValue().getRequests(0);
        assertEquals("gs://chat-app.appspot.com/images/msg123/photo.png", request.getImage().getSource().getImageUri());
        assertEquals(Feature.Type.SAFE_SEARCH_DETECTION, request.getFeatures(0).getType());
    }

    @Test
    void testClassify_ErrorInResponse() {
        // Given
        when(client.batchAnnotateImages(any(BatchAnnotateImagesRequest.class))).thenReturn(respond(
                AnnotateImageResponse.newBuilder()
                        .setError(Status.newBuilder().setCode(7).setMessage("permission denied"))
                        .build()));

        // When / Then
        assertThrows(UpstreamServiceException.class, () -> classifier.classify(image));
    }

    @Test
    void testClassify_EmptyResponse() {
        // Given
        when(client.batchAnnotateImages(any(BatchAnnotateImagesRequest.class)))
                .thenReturn(BatchAnnotateImagesResponse.getDefaultInstance());

        // When / Then
        assertThrows(UpstreamServiceException.class, () -> classifier.classify(image));
    }

    @Test
    void testToLikelihood_Unrecognized() {
        // When / Then
        assertEquals(Likelihood.UNKNOWN, CloudVisionImageClassifier.toLikelihood(com.google.cloud.vision.v1.Likelihood.UNRECOGNIZED));
        assertEquals(Likelihood.VERY_LIKELY, CloudVisionImageClassifier.toLikelihood(com.google.cloud.vision.v1.Likelihood.VERY_LIKELY));
    }
}
