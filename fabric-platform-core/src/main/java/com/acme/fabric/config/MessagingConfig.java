package com.acme.fabric.config;

/**
 * Topic names and inbound defaults for fabric messaging. Pure POJO - no framework dependencies.
 */
public class MessagingConfig {

  private String outboundTopic = "app.fabric";
  private String inboundSubject = "erp.fabric";
  private String defaultMeasureUnit = "MB";
  private String defaultOfferStatus = "ACTIVE";

  /** Topic that REST-originated fabric events are published to. */
  public String getOutboundTopic() {
    return outboundTopic;
  }

  public void setOutboundTopic(String outboundTopic) {
    this.outboundTopic = outboundTopic;
  }

  /** Subject the ERP fabric event handler is registered for. */
  public String getInboundSubject() {
    return inboundSubject;
  }

  public void setInboundSubject(String inboundSubject) {
    this.inboundSubject = inboundSubject;
  }

  /** Measure unit applied when an inbound ERP event omits one. */
  public String getDefaultMeasureUnit() {
    return defaultMeasureUnit;
  }

  public void setDefaultMeasureUnit(String defaultMeasureUnit) {
    this.defaultMeasureUnit = defaultMeasureUnit;
  }

  /** Offer status applied when an inbound ERP event omits one. */
  public String getDefaultOfferStatus() {
    return defaultOfferStatus;
  }

  public void setDefaultOfferStatus(String defaultOfferStatus) {
    this.defaultOfferStatus = defaultOfferStatus;
  }
}
